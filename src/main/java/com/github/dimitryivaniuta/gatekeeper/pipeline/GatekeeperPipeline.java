package com.github.dimitryivaniuta.gatekeeper.pipeline;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a request through the gates in a fixed order: edge rate limit, host, IP, token.
 *
 * <p>The first rejection ends the run; later gates are not evaluated, so a host rejection never
 * costs a directory lookup. The order is fixed by the constructor and cannot be configured.
 * A gate that throws is treated as unavailable for that request.
 */
@Slf4j
public class GatekeeperPipeline {

    private final List<Gate> gates;
    private final AuditLogger audit;
    private final GatekeeperMetrics metrics;

    public GatekeeperPipeline(Gate rateLimitGate,
                              Gate hostGate,
                              Gate ipGate,
                              Gate tokenGate,
                              AuditLogger audit,
                              GatekeeperMetrics metrics) {
        this.gates = List.of(
                Objects.requireNonNull(rateLimitGate, "rateLimitGate must not be null"),
                Objects.requireNonNull(hostGate, "hostGate must not be null"),
                Objects.requireNonNull(ipGate, "ipGate must not be null"),
                Objects.requireNonNull(tokenGate, "tokenGate must not be null"));
        this.audit = audit;
        this.metrics = metrics;
    }

    public PipelineOutcome admit(GateRequest request) {
        long start = System.nanoTime();
        List<GatekeeperState> trail = new ArrayList<>();
        trail.add(GatekeeperState.ENTERED);
        Map<String, String> headers = new LinkedHashMap<>();

        for (Gate gate : gates) {
            GateDecision decision = evaluate(gate, request);
            headers.putAll(decision.responseHeaders());

            if (decision.rejected()) {
                trail.add(GatekeeperState.REJECTED);
                metrics.rejection(gate.name(), decision.reason().tag());
                metrics.recordPipeline("rejected", System.nanoTime() - start);
                log.debug("Request rejected by gate={} reason={} path={}", gate.name(), decision.reason(), request.path());
                return new PipelineOutcome(GatekeeperState.REJECTED, decision, gate.name(), headers, trail);
            }
            trail.add(gate.passedState());
        }

        trail.add(GatekeeperState.ADMITTED);
        metrics.recordPipeline("admitted", System.nanoTime() - start);
        return new PipelineOutcome(GatekeeperState.ADMITTED, GateDecision.allow(), null, headers, trail);
    }

    private GateDecision evaluate(Gate gate, GateRequest request) {
        try {
            return gate.evaluate(request);
        } catch (RuntimeException ex) {
            log.error("Gate {} failed for path={}", gate.name(), request.path(), ex);
            audit.gateFailure(request, gate.name(), ex);
            return GateDecision.reject(RejectionReason.UNAVAILABLE, "Admission check failed");
        }
    }
}
