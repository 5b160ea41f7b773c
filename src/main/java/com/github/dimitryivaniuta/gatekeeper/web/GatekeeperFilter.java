package com.github.dimitryivaniuta.gatekeeper.web;

import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperPipeline;
import com.github.dimitryivaniuta.gatekeeper.pipeline.PipelineOutcome;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet entry point of the admission pipeline. Admitted requests continue down the chain with the
 * gates' response headers already set; rejected requests are answered here and never reach a handler.
 */
public class GatekeeperFilter extends OncePerRequestFilter {

    private final GatekeeperPipeline pipeline;
    private final GateRequestFactory requestFactory;
    private final RejectionResponseWriter rejectionWriter;

    public GatekeeperFilter(GatekeeperPipeline pipeline,
                            GateRequestFactory requestFactory,
                            RejectionResponseWriter rejectionWriter) {
        this.pipeline = pipeline;
        this.requestFactory = requestFactory;
        this.rejectionWriter = rejectionWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        GateRequest gateRequest = requestFactory.create(request);
        PipelineOutcome outcome = pipeline.admit(gateRequest);

        outcome.responseHeaders().forEach(response::setHeader);

        if (!outcome.admitted()) {
            rejectionWriter.write(response, outcome.decision());
            return;
        }
        request.setAttribute(RequestContextKeys.GATEKEEPER_OUTCOME_ATTRIBUTE, outcome);
        chain.doFilter(request, response);
    }
}
