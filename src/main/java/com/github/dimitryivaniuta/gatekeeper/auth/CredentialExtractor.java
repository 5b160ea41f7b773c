package com.github.dimitryivaniuta.gatekeeper.auth;

import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import org.springframework.http.HttpHeaders;

import java.util.Optional;

/**
 * Pulls the API token from a request. {@code Authorization: Bearer <token>} wins over
 * {@code X-Api-Key}; the other form is ignored once one is found.
 */
public final class CredentialExtractor {

    public static final String API_KEY_HEADER = "X-Api-Key";
    private static final String BEARER_PREFIX = "bearer ";

    private CredentialExtractor() {}

    public static Optional<String> extract(GateRequest request) {
        String auth = request.header(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.length() > BEARER_PREFIX.length()
                && auth.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = auth.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) return Optional.of(token);
        }
        return Optional.ofNullable(request.header(API_KEY_HEADER));
    }
}
