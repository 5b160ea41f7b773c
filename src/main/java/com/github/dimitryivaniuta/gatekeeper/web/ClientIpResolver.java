package com.github.dimitryivaniuta.gatekeeper.web;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the caller address used by the IP authorizer and audit events.
 *
 * <p>Order: {@code X-Forwarded-For}, then {@code X-Real-IP}, then the connection address. With no
 * trusted proxies configured the first forwarded hop is taken as-is; otherwise the list is walked
 * from the right and trusted proxy hops are skipped.
 */
public final class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private final Set<String> trustedProxies;

    public ClientIpResolver(Collection<String> trustedProxies) {
        this.trustedProxies = trustedProxies == null ? Set.of() : trustedProxies.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .collect(Collectors.toUnmodifiableSet());
    }

    public String resolve(String forwardedFor, String realIp, String remoteAddress) {
        String fromForwarded = fromForwardedFor(forwardedFor);
        if (fromForwarded != null) return fromForwarded;
        if (realIp != null && !realIp.isBlank()) return realIp.trim();
        if (remoteAddress != null && !remoteAddress.isBlank()) return remoteAddress.trim();
        return UNKNOWN;
    }

    private String fromForwardedFor(String header) {
        if (header == null || header.isBlank()) return null;
        String[] hops = header.split(",");

        if (trustedProxies.isEmpty()) {
            String first = hops[0].trim();
            return first.isEmpty() ? null : first;
        }

        String leftmost = null;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (hop.isEmpty()) continue;
            leftmost = hop;
            if (!trustedProxies.contains(hop)) return hop;
        }
        // every hop is a trusted proxy
        return leftmost;
    }
}
