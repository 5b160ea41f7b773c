package com.github.dimitryivaniuta.gatekeeper.pipeline;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single gate.
 *
 * @param responseHeaders headers the gate wants on the response, whatever the outcome
 * @param retryAfterSeconds only set for rate-limit rejections
 */
public record GateDecision(
        boolean allowed,
        RejectionReason reason,
        String message,
        Map<String, String> responseHeaders,
        Long retryAfterSeconds
) {
    private static final GateDecision ALLOW = new GateDecision(true, null, null, Map.of(), null);

    public GateDecision {
        responseHeaders = (responseHeaders == null) ? Map.of() : Map.copyOf(responseHeaders);
        if (!allowed) Objects.requireNonNull(reason, "reason is required for a rejection");
    }

    public static GateDecision allow() {
        return ALLOW;
    }

    public static GateDecision allow(Map<String, String> responseHeaders) {
        return new GateDecision(true, null, null, responseHeaders, null);
    }

    public static GateDecision reject(RejectionReason reason, String message) {
        return new GateDecision(false, reason, message, Map.of(), null);
    }

    public static GateDecision rateLimited(Map<String, String> responseHeaders, long retryAfterSeconds) {
        return new GateDecision(false, RejectionReason.RATE_LIMITED, "Too many requests", responseHeaders, retryAfterSeconds);
    }

    public boolean rejected() {
        return !allowed;
    }
}
