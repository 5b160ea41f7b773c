package com.github.dimitryivaniuta.gatekeeper.auth;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditEventKind;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.directory.DirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.directory.LookupOutcome;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperState;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;

/**
 * Admits callers whose resolved address has an active allow-list entry.
 * Inactive and unknown addresses are rejected the same way.
 */
public class IpAuthorizer extends AllowListGate {

    private final DirectoryLookup directory;

    public IpAuthorizer(boolean enabled, PublicRoutes publicRoutes, DirectoryLookup directory, AuditLogger audit) {
        super(enabled, publicRoutes, audit);
        this.directory = directory;
    }

    @Override
    public GatekeeperState passedState() {
        return GatekeeperState.IP_CHECKED;
    }

    @Override
    public String name() {
        return "ip";
    }

    @Override
    protected GateDecision authorize(GateRequest request) {
        LookupOutcome outcome = directory.ipAddressStatus(request.clientIp());
        if (outcome.authorizes()) {
            return GateDecision.allow();
        }
        audit.rejection(AuditEventKind.UNAUTHORIZED_IP, request, "ip=" + request.clientIp() + " outcome=" + outcome);
        return GateDecision.reject(RejectionReason.FORBIDDEN_IP, "IP address not allowed");
    }
}
