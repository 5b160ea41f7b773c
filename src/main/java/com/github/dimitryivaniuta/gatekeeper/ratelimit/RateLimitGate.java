package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditEventKind;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.pipeline.Gate;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperState;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Edge-tier gate: counts the request against its (identity, route) window.
 *
 * <p>Allowed requests get {@code X-RateLimit-*} headers; rejected ones additionally get
 * {@code Retry-After}. Degraded (fail-open) admissions get no rate-limit headers at all.
 */
public class RateLimitGate implements Gate {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";

    private final boolean enabled;
    private final boolean useForwardedIdentity;
    private final RateLimitRuleResolver rules;
    private final DistributedRateLimiter limiter;
    private final AuditLogger audit;
    private final GatekeeperMetrics metrics;
    private final Clock clock;

    public RateLimitGate(boolean enabled,
                         boolean useForwardedIdentity,
                         RateLimitRuleResolver rules,
                         DistributedRateLimiter limiter,
                         AuditLogger audit,
                         GatekeeperMetrics metrics,
                         Clock clock) {
        this.enabled = enabled;
        this.useForwardedIdentity = useForwardedIdentity;
        this.rules = rules;
        this.limiter = limiter;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public GatekeeperState passedState() {
        return GatekeeperState.EDGE_LIMITED;
    }

    @Override
    public String name() {
        return "rate_limit";
    }

    @Override
    public GateDecision evaluate(GateRequest request) {
        if (!enabled) return GateDecision.allow();

        RateLimitRule rule = rules.resolve(request.path());
        String identity = useForwardedIdentity ? request.clientIp() : request.remoteAddress();
        RateLimitDecision decision = limiter.check(identity, request.path(), rule.limit(), rule.windowSeconds());

        if (decision.degraded()) {
            metrics.rateLimitDegraded(rule.pattern());
            audit.rateLimitDegraded(request, decision.key(), decision.failure());
            return GateDecision.allow();
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(LIMIT_HEADER, String.valueOf(decision.limit()));
        headers.put(REMAINING_HEADER, String.valueOf(decision.remaining()));
        headers.put(RESET_HEADER, String.valueOf(clock.instant().getEpochSecond() + decision.ttlSeconds()));

        if (decision.allowed()) {
            metrics.rateLimitAllowed(rule.pattern());
            return GateDecision.allow(headers);
        }

        headers.put(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        metrics.rateLimitRejected(rule.pattern());
        audit.rejection(AuditEventKind.RATE_LIMITED, request,
                "count=" + decision.currentCount() + " limit=" + decision.limit() + " rule=" + rule.pattern());
        return GateDecision.rateLimited(headers, decision.retryAfterSeconds());
    }
}
