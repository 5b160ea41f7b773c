package com.github.dimitryivaniuta.gatekeeper.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateDecision;
import com.github.dimitryivaniuta.gatekeeper.pipeline.RejectionReason;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes a gate rejection. Rate-limit rejections get {@code {"error":"rate_limited","retry_after":N}};
 * every other rejection gets {@code {"error":..., "message":...}}.
 */
public class RejectionResponseWriter {

    private final ObjectMapper mapper;

    public RejectionResponseWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(HttpServletResponse response, GateDecision decision) throws IOException {
        RejectionReason reason = decision.reason();
        response.setStatus(reason.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), body(decision));
    }

    static Map<String, Object> body(GateDecision decision) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", decision.reason().tag());
        if (decision.reason() == RejectionReason.RATE_LIMITED) {
            body.put("retry_after", decision.retryAfterSeconds() == null ? 0L : decision.retryAfterSeconds());
        } else {
            body.put("message", decision.message());
        }
        return body;
    }
}
