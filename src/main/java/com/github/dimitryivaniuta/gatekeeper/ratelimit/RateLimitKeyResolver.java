package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Builds counter keys for (caller identity, route).
 *
 * <p>Key format is stable across deployments sharing one store:
 * {@code <prefix>:ip:<base64(identity)>:p:<path>}. The identity is encoded so IPv6 colons
 * cannot collide with the separators.
 */
public final class RateLimitKeyResolver {

    private static final String UNKNOWN = "unknown";

    private final String prefix;

    public RateLimitKeyResolver(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        this.prefix = prefix.trim();
    }

    public String key(String identity, String route) {
        String id = (identity == null || identity.isBlank()) ? UNKNOWN : identity.trim();
        String encoded = Base64.getEncoder().encodeToString(id.getBytes(StandardCharsets.UTF_8));
        return prefix + ":ip:" + encoded + ":p:" + (route == null ? "" : route);
    }
}
