package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Result of one limiter check.
 *
 * <p>A degraded decision means the counter store could not be consulted. It is always allowed and
 * carries no quota metadata.
 */
public record RateLimitDecision(
        boolean allowed,
        String key,
        long limit,
        long currentCount,
        long ttlSeconds,
        boolean degraded,
        Throwable failure
) {

    static RateLimitDecision counted(String key, long limit, WindowCounter counter) {
        return new RateLimitDecision(counter.count() <= limit, key, limit, counter.count(), counter.ttlSeconds(), false, null);
    }

    static RateLimitDecision failOpen(String key, Throwable failure) {
        return new RateLimitDecision(true, key, 0, 0, 0, true, failure);
    }

    public long remaining() {
        return Math.max(0, limit - currentCount);
    }

    public long retryAfterSeconds() {
        return ttlSeconds;
    }
}
