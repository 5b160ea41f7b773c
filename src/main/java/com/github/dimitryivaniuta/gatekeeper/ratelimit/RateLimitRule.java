package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Threshold for one route class.
 *
 * @param pattern Ant-style path pattern; {@code "default"} for the fallback rule
 */
public record RateLimitRule(String pattern, int limit, int windowSeconds) {

    public static final String DEFAULT_PATTERN = "default";

    public RateLimitRule {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1 for " + pattern);
        if (windowSeconds < 1) throw new IllegalArgumentException("windowSeconds must be >= 1 for " + pattern);
    }
}
