package com.github.dimitryivaniuta.gatekeeper.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable audit record. Headers are already redacted when the event is built.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        Severity severity,
        AuditEventKind event,
        String correlationId,
        String clientIp,
        String route,
        String method,
        Map<String, String> headers,
        String body,
        Integer status,
        Long durationMs,
        String detail
) {
    public AuditEvent {
        headers = (headers == null) ? null : Map.copyOf(headers);
    }
}
