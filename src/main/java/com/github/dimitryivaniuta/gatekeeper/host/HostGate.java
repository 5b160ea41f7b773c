package com.github.dimitryivaniuta.gatekeeper.host;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditEventKind;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.pipeline.Gate;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperState;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;

/**
 * Rejects requests whose Host header matches no allowed pattern. Has no external dependency and
 * no disable switch.
 */
public class HostGate implements Gate {

    private final HostValidator validator;
    private final AuditLogger audit;

    public HostGate(HostValidator validator, AuditLogger audit) {
        this.validator = validator;
        this.audit = audit;
    }

    @Override
    public GatekeeperState passedState() {
        return GatekeeperState.HOST_CHECKED;
    }

    @Override
    public String name() {
        return "host";
    }

    @Override
    public GateDecision evaluate(GateRequest request) {
        if (validator.isAllowed(request.host())) {
            return GateDecision.allow();
        }
        audit.rejection(AuditEventKind.HOST_REJECTED, request, "host=" + request.host());
        return GateDecision.reject(RejectionReason.INVALID_HOST, "Host not allowed");
    }
}
