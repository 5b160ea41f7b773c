package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Fixed-window limiter over a shared {@link CounterStore}.
 *
 * <p>Fails open: if the store errors, or the circuit breaker around it is open, the request is
 * allowed and the decision is marked degraded. Operators who need fail-closed behaviour must
 * reject degraded decisions themselves.
 */
@Slf4j
public class DistributedRateLimiter {

    private final CounterStore store;
    private final CircuitBreaker circuitBreaker;
    private final RateLimitKeyResolver keyResolver;

    public DistributedRateLimiter(CounterStore store, CircuitBreaker circuitBreaker, RateLimitKeyResolver keyResolver) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
        this.keyResolver = Objects.requireNonNull(keyResolver, "keyResolver must not be null");
    }

    public RateLimitDecision check(String identity, String route, int limit, int windowSeconds) {
        String key = keyResolver.key(identity, route);
        WindowCounter counter;
        try {
            counter = circuitBreaker.executeSupplier(() -> store.incrementInWindow(key, windowSeconds));
        } catch (CallNotPermittedException ex) {
            log.debug("Counter store breaker open, admitting key={} without limit", key);
            return RateLimitDecision.failOpen(key, ex);
        } catch (CounterStoreException ex) {
            log.warn("Counter store unavailable, admitting key={} without limit: {}", key, ex.getMessage());
            return RateLimitDecision.failOpen(key, ex);
        }

        // TTL 0 means under a second left in the window; a negative TTL means no expiry was seen.
        if (counter.ttlSeconds() == 0) {
            counter = new WindowCounter(counter.count(), 1);
        } else if (counter.ttlSeconds() < 0) {
            counter = new WindowCounter(counter.count(), windowSeconds);
        }
        return RateLimitDecision.counted(key, limit, counter);
    }
}
