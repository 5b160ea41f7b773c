package com.github.dimitryivaniuta.gatekeeper.host;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks a declared Host header against the configured patterns. Stateless and side-effect free.
 */
public final class HostValidator {

    private final List<HostPattern> patterns;

    public HostValidator(Collection<String> allowed) {
        if (allowed == null || allowed.isEmpty()) {
            throw new InvalidHostPatternException("<none>", "at least one allowed host is required");
        }
        this.patterns = allowed.stream().map(HostPattern::parse).toList();
    }

    public List<HostPattern> patterns() {
        return patterns;
    }

    public boolean isAllowed(String hostHeader) {
        return match(hostHeader).isPresent();
    }

    public Optional<HostPattern> match(String hostHeader) {
        String host = normalize(hostHeader);
        if (host.isEmpty()) return Optional.empty();
        return patterns.stream().filter(p -> p.matches(host)).findFirst();
    }

    /** Lower-cases and strips the port; keeps IPv6 brackets. */
    static String normalize(String hostHeader) {
        if (hostHeader == null) return "";
        String h = hostHeader.trim().toLowerCase(Locale.ROOT);
        if (h.startsWith("[")) {
            int end = h.indexOf(']');
            return (end < 0) ? "" : h.substring(0, end + 1);
        }
        int colon = h.indexOf(':');
        return (colon >= 0) ? h.substring(0, colon) : h;
    }
}
