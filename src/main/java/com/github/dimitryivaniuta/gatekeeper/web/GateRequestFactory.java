package com.github.dimitryivaniuta.gatekeeper.web;

import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.web.util.UrlPathHelper;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Collections;
import java.util.function.Supplier;

/**
 * Builds the {@link GateRequest} for a servlet request.
 *
 * <p>The body is never read up front. The snapshot supplier reads at most {@code maxBodyChars}
 * characters on first use and remembers the result; it is only invoked when a rejection is audited,
 * at which point nothing downstream will consume the body.
 */
@Slf4j
public class GateRequestFactory {

    private static final UrlPathHelper PATH_HELPER = newPathHelper();

    private final ClientIpResolver ipResolver;
    private final int maxBodyChars;

    public GateRequestFactory(ClientIpResolver ipResolver, int maxBodyChars) {
        this.ipResolver = ipResolver;
        this.maxBodyChars = maxBodyChars;
    }

    public GateRequest create(HttpServletRequest request) {
        HttpHeaders headers = new HttpHeaders();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.addAll(name, Collections.list(request.getHeaders(name)));
        }

        String clientIp = ipResolver.resolve(
                request.getHeader(RequestContextKeys.X_FORWARDED_FOR),
                request.getHeader(RequestContextKeys.X_REAL_IP),
                request.getRemoteAddr());

        return GateRequest.builder()
                .method(request.getMethod())
                .path(path(request))
                .query(request.getQueryString())
                .host(request.getHeader(HttpHeaders.HOST))
                .clientIp(clientIp)
                .remoteAddress(request.getRemoteAddr())
                .correlationId(correlationId(request))
                .headers(headers)
                .bodySnapshot(memoize(() -> readBody(request)))
                .build();
    }

    /**
     * Path as Spring MVC sees it when mapping a handler: context path removed, {@code %xx} decoded,
     * {@code ;matrix} content and duplicate slashes dropped. Rate-limit keys, rule matching and public
     * routes all key on this value, so {@code /d%61ta} and {@code /data;v=1} count against {@code /data}.
     */
    static String path(HttpServletRequest request) {
        String path = PATH_HELPER.getPathWithinApplication(request);
        return (path == null || path.isEmpty()) ? "/" : path;
    }

    private static String correlationId(HttpServletRequest request) {
        Object attr = request.getAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE);
        return (attr != null) ? attr.toString() : MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY);
    }

    String readBody(HttpServletRequest request) {
        if (maxBodyChars <= 0 || request.getContentLengthLong() == 0) return null;
        try {
            BufferedReader reader = request.getReader();
            char[] buf = new char[Math.min(maxBodyChars, 8192)];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < maxBodyChars && (n = reader.read(buf, 0, Math.min(buf.length, maxBodyChars - sb.length()))) != -1) {
                sb.append(buf, 0, n);
            }
            return sb.length() == 0 ? null : sb.toString();
        } catch (IOException | IllegalStateException ex) {
            log.debug("Request body not available for audit snapshot: {}", ex.toString());
            return null;
        }
    }

    private static UrlPathHelper newPathHelper() {
        UrlPathHelper helper = new UrlPathHelper();
        helper.setUrlDecode(true);
        helper.setRemoveSemicolonContent(true);
        return helper;
    }

    private static Supplier<String> memoize(Supplier<String> delegate) {
        return new Supplier<>() {
            private boolean done;
            private String value;

            @Override
            public synchronized String get() {
                if (!done) {
                    value = delegate.get();
                    done = true;
                }
                return value;
            }
        };
    }
}
