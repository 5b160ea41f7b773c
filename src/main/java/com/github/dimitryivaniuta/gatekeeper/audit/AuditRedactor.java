package com.github.dimitryivaniuta.gatekeeper.audit;

import org.springframework.http.HttpHeaders;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Replaces values of sensitive headers and query parameters before anything is serialized.
 * Names match case-insensitively. Works on copies; the request's own headers and query are never touched.
 */
public final class AuditRedactor {

    public static final String REDACTED = "[REDACTED]";

    private final Set<String> sensitiveHeaders;
    private final Set<String> sensitiveQueryParams;

    public AuditRedactor(Collection<String> sensitiveHeaderNames, Collection<String> sensitiveQueryParamNames) {
        this.sensitiveHeaders = normalize(sensitiveHeaderNames);
        this.sensitiveQueryParams = normalize(sensitiveQueryParamNames);
    }

    public boolean isSensitive(String headerName) {
        return headerName != null && sensitiveHeaders.contains(headerName.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> redact(HttpHeaders headers) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) return out;
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            String name = e.getKey();
            out.put(name, isSensitive(name) ? REDACTED : String.join(", ", e.getValue()));
        }
        return out;
    }

    /**
     * Raw query string with the values of sensitive parameters replaced. Parameter order and
     * non-sensitive pairs are kept as sent.
     */
    public String redactQuery(String query) {
        if (query == null || query.isEmpty() || sensitiveQueryParams.isEmpty()) return query;
        StringJoiner out = new StringJoiner("&");
        for (String pair : query.split("&", -1)) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            out.add(sensitiveQueryParams.contains(decodedName(name)) ? name + "=" + REDACTED : pair);
        }
        return out.toString();
    }

    /** Path plus the redacted query, as written to audit events. */
    public String route(String path, String query) {
        String q = redactQuery(query);
        return (q == null || q.isEmpty()) ? path : path + "?" + q;
    }

    private static String decodedName(String name) {
        String decoded;
        try {
            decoded = URLDecoder.decode(name, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            decoded = name;
        }
        return decoded.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalize(Collection<String> names) {
        if (names == null) return Set.of();
        return names.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
