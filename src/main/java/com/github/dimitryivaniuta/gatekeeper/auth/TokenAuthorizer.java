package com.github.dimitryivaniuta.gatekeeper.auth;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditEventKind;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.directory.DirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.directory.LookupOutcome;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperState;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;

import java.util.Optional;

/**
 * Admits requests carrying an active API token. A missing token and a bad token get the same
 * client-visible 401 but different audit events.
 */
public class TokenAuthorizer extends AllowListGate {

    private static final String MESSAGE = "Invalid or missing API token";

    private final DirectoryLookup directory;

    public TokenAuthorizer(boolean enabled, PublicRoutes publicRoutes, DirectoryLookup directory, AuditLogger audit) {
        super(enabled, publicRoutes, audit);
        this.directory = directory;
    }

    @Override
    public GatekeeperState passedState() {
        return GatekeeperState.TOKEN_CHECKED;
    }

    @Override
    public String name() {
        return "token";
    }

    @Override
    protected GateDecision authorize(GateRequest request) {
        Optional<String> token = CredentialExtractor.extract(request);
        if (token.isEmpty()) {
            audit.rejection(AuditEventKind.MISSING_TOKEN, request, "no credential presented");
            return GateDecision.reject(RejectionReason.UNAUTHORIZED_TOKEN, MESSAGE);
        }

        LookupOutcome outcome = directory.tokenStatus(token.get());
        if (outcome.authorizes()) {
            return GateDecision.allow();
        }
        audit.rejection(AuditEventKind.INVALID_TOKEN, request, "outcome=" + outcome);
        return GateDecision.reject(RejectionReason.UNAUTHORIZED_TOKEN, MESSAGE);
    }
}
