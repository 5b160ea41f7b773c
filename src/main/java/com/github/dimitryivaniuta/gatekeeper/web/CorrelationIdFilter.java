package com.github.dimitryivaniuta.gatekeeper.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Outermost filter: every response, rejections included, carries a correlation id, and every log
 * line written while the request is in flight has it in the MDC.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter implements Filter {

    private static final int MAX_LENGTH = 128;

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        String corr = request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
        if (corr == null || corr.isBlank() || corr.length() > MAX_LENGTH) corr = UUID.randomUUID().toString();
        corr = corr.trim();

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        request.setAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }
}
