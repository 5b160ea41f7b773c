package com.github.dimitryivaniuta.gatekeeper.host;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One allowed-host entry.
 *
 * <ul>
 *   <li>{@link Kind#EXACT}: IP literal, matched by equality only</li>
 *   <li>{@link Kind#DOMAIN}: {@code example.com}, matches itself and any subdomain</li>
 *   <li>{@link Kind#WILDCARD}: {@code .example.com}, matches subdomains at any depth, not the bare domain</li>
 * </ul>
 */
public record HostPattern(Kind kind, String value) {

    public enum Kind { EXACT, DOMAIN, WILDCARD }

    private static final Pattern LABEL = Pattern.compile("[a-z0-9_]([a-z0-9_-]*[a-z0-9_])?");
    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6_BRACKETED = Pattern.compile("\\[[0-9a-f:.]+]");

    public static HostPattern parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidHostPatternException(String.valueOf(raw), "must not be blank");
        }
        String p = raw.trim().toLowerCase(Locale.ROOT);

        if (IPV4.matcher(p).matches() || IPV6_BRACKETED.matcher(p).matches()) {
            return new HostPattern(Kind.EXACT, p);
        }
        if (p.startsWith(".")) {
            requireDomain(raw, p.substring(1));
            return new HostPattern(Kind.WILDCARD, p);
        }
        requireDomain(raw, p);
        return new HostPattern(Kind.DOMAIN, p);
    }

    private static void requireDomain(String raw, String domain) {
        if (domain.isEmpty()) {
            throw new InvalidHostPatternException(raw, "domain part is empty");
        }
        for (String label : domain.split("\\.", -1)) {
            if (label.isEmpty()) {
                throw new InvalidHostPatternException(raw, "empty label");
            }
            if (label.length() > 63 || !LABEL.matcher(label).matches()) {
                throw new InvalidHostPatternException(raw, "illegal label '" + label + "'");
            }
        }
    }

    /**
     * @param host lower-case host without port
     */
    public boolean matches(String host) {
        if (host == null || host.isEmpty()) return false;
        return switch (kind) {
            case EXACT -> host.equals(value);
            case DOMAIN -> host.equals(value) || host.endsWith("." + value);
            case WILDCARD -> host.length() > value.length() && host.endsWith(value);
        };
    }
}
