package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Shared counter store used by the distributed limiter.
 */
public interface CounterStore {

    /**
     * Increments the counter for {@code key} and returns the post-increment value with the remaining TTL.
     * The increment, the expiry set on window creation and the TTL read happen as one atomic unit
     * on the store, so concurrent callers can never leave a key without an expiry.
     *
     * @throws CounterStoreException when the store is unreachable or the call fails
     */
    WindowCounter incrementInWindow(String key, int windowSeconds);
}
