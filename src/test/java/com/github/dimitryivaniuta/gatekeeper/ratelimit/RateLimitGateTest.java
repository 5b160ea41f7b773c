package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditEventKind;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;
import com.github.dimitryivaniuta.gatekeeper.support.InMemoryCounterStore;
import com.github.dimitryivaniuta.gatekeeper.support.TestRequests;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RateLimitGateTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final AuditLogger audit = mock(AuditLogger.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final InMemoryCounterStore store = new InMemoryCounterStore();
    private final RateLimitRuleResolver rules = new RateLimitRuleResolver(List.of(),
            new RateLimitRule(RateLimitRule.DEFAULT_PATTERN, 2, 60));

    private RateLimitGate gate(CounterStore counterStore, boolean useForwardedIdentity) {
        DistributedRateLimiter limiter = new DistributedRateLimiter(counterStore, CircuitBreaker.ofDefaults("t"),
                new RateLimitKeyResolver("rl"));
        return new RateLimitGate(true, useForwardedIdentity, rules, limiter, audit,
                new GatekeeperMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void allowedRequestsCarryQuotaHeaders() {
        GateDecision d = gate(store, false).evaluate(TestRequests.get("/data").build());

        assertThat(d.allowed()).isTrue();
        assertThat(d.responseHeaders())
                .containsEntry(RateLimitGate.LIMIT_HEADER, "2")
                .containsEntry(RateLimitGate.REMAINING_HEADER, "1")
                .containsEntry(RateLimitGate.RESET_HEADER, String.valueOf(NOW.getEpochSecond() + 60))
                .doesNotContainKey(HttpHeaders.RETRY_AFTER);
    }

    @Test
    void overLimitIsRejectedWithRetryAfterAndAudited() {
        RateLimitGate gate = gate(store, false);
        gate.evaluate(TestRequests.get("/data").build());
        gate.evaluate(TestRequests.get("/data").build());

        GateDecision d = gate.evaluate(TestRequests.get("/data").build());

        assertThat(d.reason()).isEqualTo(RejectionReason.RATE_LIMITED);
        assertThat(d.retryAfterSeconds()).isEqualTo(60L);
        assertThat(d.responseHeaders())
                .containsEntry(HttpHeaders.RETRY_AFTER, "60")
                .containsEntry(RateLimitGate.REMAINING_HEADER, "0");
        verify(audit).rejection(eq(AuditEventKind.RATE_LIMITED), any(), anyString());
        assertThat(registry.counter("gatekeeper_ratelimit_rejected_total", "route", "default").count()).isEqualTo(1.0);
    }

    @Test
    void degradedAdmissionHasNoRateLimitHeaders() {
        CounterStore refusing = (key, window) -> {
            throw new CounterStoreException("Connection refused");
        };

        GateDecision d = gate(refusing, false).evaluate(TestRequests.get("/data").build());

        assertThat(d.allowed()).isTrue();
        assertThat(d.responseHeaders()).isEmpty();
        verify(audit).rateLimitDegraded(any(), anyString(), any(CounterStoreException.class));
        assertThat(registry.counter("gatekeeper_ratelimit_degraded_total", "route", "default").count()).isEqualTo(1.0);
    }

    @Test
    void identityDefaultsToConnectionAddress() {
        RateLimitGate gate = gate(store, false);

        gate.evaluate(TestRequests.get("/data").clientIp("1.1.1.1").remoteAddress("10.0.0.1").build());
        gate.evaluate(TestRequests.get("/data").clientIp("2.2.2.2").remoteAddress("10.0.0.1").build());

        assertThat(store.counts()).hasSize(1);
        assertThat(store.counts().values()).containsExactly(2L);
    }

    @Test
    void forwardedIdentityKeysByResolvedClient() {
        RateLimitGate gate = gate(store, true);

        gate.evaluate(TestRequests.get("/data").clientIp("1.1.1.1").remoteAddress("10.0.0.1").build());
        gate.evaluate(TestRequests.get("/data").clientIp("2.2.2.2").remoteAddress("10.0.0.1").build());

        assertThat(store.counts()).hasSize(2);
    }

    @Test
    void disabledGateDoesNotCount() {
        DistributedRateLimiter limiter = new DistributedRateLimiter(store, CircuitBreaker.ofDefaults("t"),
                new RateLimitKeyResolver("rl"));
        RateLimitGate disabled = new RateLimitGate(false, false, rules, limiter, audit,
                new GatekeeperMetrics(registry), Clock.systemUTC());

        assertThat(disabled.evaluate(TestRequests.get("/data").build()).allowed()).isTrue();
        assertThat(store.counts()).isEmpty();
    }
}
