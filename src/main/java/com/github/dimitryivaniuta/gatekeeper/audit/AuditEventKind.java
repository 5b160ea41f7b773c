package com.github.dimitryivaniuta.gatekeeper.audit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds written to the audit log. The tag is the stable value operators search for.
 */
public enum AuditEventKind {
    REQUEST_RECEIVED("request_received"),
    RESPONSE_SENT("response_sent"),
    HOST_REJECTED("host_rejected"),
    RATE_LIMITED("rate_limited"),
    RATE_LIMIT_DEGRADED("rate_limit_degraded"),
    UNAUTHORIZED_IP("unauthorized_ip_address_attempt"),
    MISSING_TOKEN("unauthorized_api_token_missing"),
    INVALID_TOKEN("unauthorized_api_token_attempt"),
    DIRECTORY_UNAVAILABLE("directory_unavailable"),
    GATE_FAILURE("gate_failure");

    private final String tag;

    AuditEventKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
