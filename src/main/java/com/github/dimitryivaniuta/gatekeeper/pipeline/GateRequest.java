package com.github.dimitryivaniuta.gatekeeper.pipeline;

import lombok.Builder;
import org.springframework.http.HttpHeaders;

import java.util.function.Supplier;

/**
 * Per-request values the gates inspect. Built once at pipeline entry.
 *
 * @param clientIp      resolved caller address (forwarded headers honoured)
 * @param remoteAddress raw connection address
 * @param bodySnapshot  lazily reads the body; only called when a rejection is audited
 */
@Builder
public record GateRequest(
        String method,
        String path,
        String query,
        String host,
        String clientIp,
        String remoteAddress,
        String correlationId,
        HttpHeaders headers,
        Supplier<String> bodySnapshot
) {
    public GateRequest {
        headers = (headers == null) ? HttpHeaders.EMPTY : HttpHeaders.readOnlyHttpHeaders(headers);
        if (bodySnapshot == null) bodySnapshot = () -> null;
        if (path == null) path = "";
    }

    public String header(String name) {
        String v = headers.getFirst(name);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }
}
