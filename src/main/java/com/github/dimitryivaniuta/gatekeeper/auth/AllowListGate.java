package com.github.dimitryivaniuta.gatekeeper.auth;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.directory.DirectoryUnavailableException;
import com.github.dimitryivaniuta.gatekeeper.pipeline.Gate;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;

/**
 * Shared shape of the directory-backed authorizers: disabled gates and public routes pass without a
 * lookup, and a directory outage fails closed with its own audit event and reason.
 */
public abstract class AllowListGate implements Gate {

    private final boolean enabled;
    private final PublicRoutes publicRoutes;
    protected final AuditLogger audit;

    protected AllowListGate(boolean enabled, PublicRoutes publicRoutes, AuditLogger audit) {
        this.enabled = enabled;
        this.publicRoutes = publicRoutes;
        this.audit = audit;
    }

    @Override
    public final GateDecision evaluate(GateRequest request) {
        if (!enabled || publicRoutes.isPublic(request.path())) {
            return GateDecision.allow();
        }
        try {
            return authorize(request);
        } catch (DirectoryUnavailableException ex) {
            audit.directoryUnavailable(request, name(), ex);
            return GateDecision.reject(RejectionReason.UNAVAILABLE, "Authorization directory unavailable");
        }
    }

    protected abstract GateDecision authorize(GateRequest request);
}
