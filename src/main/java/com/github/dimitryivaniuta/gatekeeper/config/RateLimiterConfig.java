package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.CounterStore;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.CounterStoreException;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.DistributedRateLimiter;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitGate;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitKeyResolver;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitRuleResolver;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RedisCounterStore;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Edge-tier rate limiting: Redis counter store behind a circuit breaker, and the gate on top.
 */
@Configuration
public class RateLimiterConfig {

    public static final String COUNTER_STORE_BREAKER = "counterStore";

    @Bean
    @SuppressWarnings("rawtypes")
    public RedisScript<List> rateLimitScript() {
        return RedisScript.of(new ClassPathResource("scripts/rate_limit.lua"), List.class);
    }

    @Bean
    @SuppressWarnings("rawtypes")
    public CounterStore counterStore(StringRedisTemplate redis, RedisScript<List> rateLimitScript) {
        return new RedisCounterStore(redis, rateLimitScript);
    }

    @Bean
    public CircuitBreaker counterStoreCircuitBreaker(GatekeeperProperties props) {
        GatekeeperProperties.RateLimit.CircuitBreaker cb = props.getRateLimit().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(cb.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(cb.getSlidingWindowSize())
                .minimumNumberOfCalls(Math.min(cb.getSlidingWindowSize(), 10))
                .waitDurationInOpenState(Duration.ofSeconds(cb.getWaitInOpenStateSeconds()))
                .recordExceptions(CounterStoreException.class)
                .build();
        return CircuitBreaker.of(COUNTER_STORE_BREAKER, config);
    }

    @Bean
    public DistributedRateLimiter distributedRateLimiter(CounterStore counterStore,
                                                         CircuitBreaker counterStoreCircuitBreaker,
                                                         GatekeeperProperties props) {
        return new DistributedRateLimiter(counterStore, counterStoreCircuitBreaker,
                new RateLimitKeyResolver(props.getRateLimit().getKeyPrefix()));
    }

    @Bean
    public RateLimitGate rateLimitGate(GatekeeperProperties props,
                                       DistributedRateLimiter limiter,
                                       AuditLogger audit,
                                       GatekeeperMetrics metrics,
                                       Clock clock) {
        GatekeeperProperties.RateLimit rl = props.getRateLimit();
        return new RateLimitGate(rl.isEnabled(), rl.isUseForwardedIdentity(),
                RateLimitRuleResolver.from(rl), limiter, audit, metrics, clock);
    }
}
