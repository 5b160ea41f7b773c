package com.github.dimitryivaniuta.gatekeeper.web;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Informational request/response trace. Sits outside the gatekeeper so rejected requests are traced too.
 * Never alters the request or the response.
 */
public class RequestTraceFilter extends OncePerRequestFilter {

    private final boolean enabled;
    private final GateRequestFactory requestFactory;
    private final AuditLogger audit;

    public RequestTraceFilter(boolean enabled, GateRequestFactory requestFactory, AuditLogger audit) {
        this.enabled = enabled;
        this.requestFactory = requestFactory;
        this.audit = audit;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        long start = System.nanoTime();
        GateRequest traced = requestFactory.create(request);
        audit.requestReceived(traced);
        try {
            chain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            audit.responseSent(traced, response.getStatus(), responseHeaders(response), durationMs);
        }
    }

    private static HttpHeaders responseHeaders(HttpServletResponse response) {
        HttpHeaders h = new HttpHeaders();
        for (String name : response.getHeaderNames()) {
            h.addAll(name, List.copyOf(response.getHeaders(name)));
        }
        return h;
    }
}
