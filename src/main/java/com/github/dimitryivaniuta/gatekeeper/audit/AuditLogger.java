package com.github.dimitryivaniuta.gatekeeper.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes gate audit events to the {@code gatekeeper.audit} logger.
 *
 * <p>Rejections are logged at ERROR with the {@link #CRITICAL} marker and carry the redacted headers
 * plus a body snapshot. Degraded-mode events go out at WARN, traces at INFO.
 *
 * <p>No method here throws: a failure while building or writing an event is reported on this
 * class's own logger and the admission decision stands.
 */
@Slf4j
@Component
public class AuditLogger {

    public static final String AUDIT_LOGGER_NAME = "gatekeeper.audit";
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper mapper;
    private final AuditRedactor redactor;
    private final Clock clock;

    public AuditLogger(ObjectMapper mapper, AuditRedactor redactor, Clock clock) {
        this.mapper = mapper;
        this.redactor = redactor;
        this.clock = clock;
    }

    /** Critical rejection event with full request context. */
    public void rejection(AuditEventKind kind, GateRequest request, String detail) {
        try {
            emit(base(request, Severity.CRITICAL, kind)
                    .body(request.bodySnapshot().get())
                    .detail(detail)
                    .build());
        } catch (RuntimeException ex) {
            reportFailure(kind, ex);
        }
    }

    /**
     * Directory outage seen by an authorizer. Same severity as a rejection but its own event kind,
     * so an outage is never mistaken for a denied caller.
     */
    public void directoryUnavailable(GateRequest request, String lookup, Throwable cause) {
        try {
            emit(base(request, Severity.CRITICAL, AuditEventKind.DIRECTORY_UNAVAILABLE)
                    .detail(lookup + " lookup failed: " + rootMessage(cause))
                    .build());
        } catch (RuntimeException ex) {
            reportFailure(AuditEventKind.DIRECTORY_UNAVAILABLE, ex);
        }
    }

    /** A gate threw instead of returning a decision. */
    public void gateFailure(GateRequest request, String gate, Throwable cause) {
        try {
            emit(base(request, Severity.CRITICAL, AuditEventKind.GATE_FAILURE)
                    .detail(gate + ": " + rootMessage(cause))
                    .build());
        } catch (RuntimeException ex) {
            reportFailure(AuditEventKind.GATE_FAILURE, ex);
        }
    }

    /** Counter store unreachable; the limiter let the request through without metadata. */
    public void rateLimitDegraded(GateRequest request, String key, Throwable cause) {
        try {
            emit(AuditEvent.builder()
                    .timestamp(Instant.now(clock))
                    .severity(Severity.WARNING)
                    .event(AuditEventKind.RATE_LIMIT_DEGRADED)
                    .correlationId(request.correlationId())
                    .clientIp(request.clientIp())
                    .route(request.path())
                    .method(request.method())
                    .detail("key=" + key + " reason=" + rootMessage(cause))
                    .build());
        } catch (RuntimeException ex) {
            reportFailure(AuditEventKind.RATE_LIMIT_DEGRADED, ex);
        }
    }

    public void requestReceived(GateRequest request) {
        try {
            emit(base(request, Severity.INFO, AuditEventKind.REQUEST_RECEIVED).build());
        } catch (RuntimeException ex) {
            reportFailure(AuditEventKind.REQUEST_RECEIVED, ex);
        }
    }

    public void responseSent(GateRequest request, int status, HttpHeaders responseHeaders, long durationMs) {
        try {
            emit(base(request, Severity.INFO, AuditEventKind.RESPONSE_SENT)
                    .headers(redactor.redact(responseHeaders))
                    .status(status)
                    .durationMs(durationMs)
                    .build());
        } catch (RuntimeException ex) {
            reportFailure(AuditEventKind.RESPONSE_SENT, ex);
        }
    }

    private AuditEvent.AuditEventBuilder base(GateRequest request, Severity severity, AuditEventKind kind) {
        return AuditEvent.builder()
                .timestamp(Instant.now(clock))
                .severity(severity)
                .event(kind)
                .correlationId(request.correlationId())
                .clientIp(request.clientIp())
                .route(redactor.route(request.path(), request.query()))
                .method(request.method())
                .headers(redactor.redact(request.headers()));
    }

    private void emit(AuditEvent event) {
        String payload = serialize(event);
        switch (event.severity()) {
            case CRITICAL -> audit.error(CRITICAL, "{} {}", event.event().tag(), payload);
            case WARNING -> audit.warn("{} {}", event.event().tag(), payload);
            default -> audit.info("{} {}", event.event().tag(), payload);
        }
    }

    private String serialize(AuditEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (Exception e) {
            // keep the record even if Jackson chokes; headers are redacted either way
            return event.toString();
        }
    }

    private static void reportFailure(AuditEventKind kind, RuntimeException ex) {
        log.warn("Audit emission failed for event={}, reason={}", kind.tag(), ex.toString());
    }

    private static String rootMessage(Throwable t) {
        if (t == null) return "unknown";
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
        String msg = cur.getMessage();
        return cur.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }
}
