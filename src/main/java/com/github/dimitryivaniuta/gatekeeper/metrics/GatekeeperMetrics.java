package com.github.dimitryivaniuta.gatekeeper.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class GatekeeperMetrics {

    private final MeterRegistry registry;

    public GatekeeperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed(String routeClass) {
        Counter.builder("gatekeeper_ratelimit_allowed_total")
                .tag("route", routeClass)
                .register(registry)
                .increment();
    }

    public void rateLimitRejected(String routeClass) {
        Counter.builder("gatekeeper_ratelimit_rejected_total")
                .tag("route", routeClass)
                .register(registry)
                .increment();
    }

    // fail-open admissions: counter store unreachable or breaker open
    public void rateLimitDegraded(String routeClass) {
        Counter.builder("gatekeeper_ratelimit_degraded_total")
                .tag("route", routeClass)
                .register(registry)
                .increment();
    }

    // ---- Pipeline ----
    public void rejection(String gate, String reason) {
        Counter.builder("gatekeeper_rejections_total")
                .tag("gate", gate)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPipeline(String outcome, long nanos) {
        Timer.builder("gatekeeper_pipeline_duration_seconds")
                .tag("outcome", outcome) // admitted | rejected
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Directory ----
    public void directoryLookup(String kind, String outcome) {
        Counter.builder("gatekeeper_directory_lookups_total")
                .tag("kind", kind)       // ip | token
                .tag("outcome", outcome) // active | inactive | not_found | unavailable
                .register(registry)
                .increment();
    }
}
