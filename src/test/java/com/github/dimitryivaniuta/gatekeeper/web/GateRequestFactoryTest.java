package com.github.dimitryivaniuta.gatekeeper.web;

import com.github.dimitryivaniuta.gatekeeper.pipeline.GateRequest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GateRequestFactoryTest {

    private final GateRequestFactory factory = new GateRequestFactory(new ClientIpResolver(List.of()), 5);

    @Test
    void capturesRequestContext() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/data/items");
        req.setQueryString("page=2");
        req.addHeader("Host", "localhost:8080");
        req.addHeader("X-Forwarded-For", "203.0.113.7");
        req.setRemoteAddr("10.0.0.3");
        req.setAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE, "corr-42");

        GateRequest g = factory.create(req);

        assertThat(g.method()).isEqualTo("GET");
        assertThat(g.path()).isEqualTo("/data/items");
        assertThat(g.query()).isEqualTo("page=2");
        assertThat(g.host()).isEqualTo("localhost:8080");
        assertThat(g.clientIp()).isEqualTo("203.0.113.7");
        assertThat(g.remoteAddress()).isEqualTo("10.0.0.3");
        assertThat(g.correlationId()).isEqualTo("corr-42");
        assertThat(g.header("x-forwarded-for")).isEqualTo("203.0.113.7");
    }

    @Test
    void bodySnapshotIsCappedAndReadOnce() {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/data");
        req.setContent("0123456789".getBytes(StandardCharsets.UTF_8));

        GateRequest g = factory.create(req);

        assertThat(g.bodySnapshot().get()).isEqualTo("01234");
        assertThat(g.bodySnapshot().get()).isEqualTo("01234");
    }

    @Test
    void emptyBodyIsNull() {
        GateRequest g = factory.create(new MockHttpServletRequest("GET", "/data"));

        assertThat(g.bodySnapshot().get()).isNull();
    }

    @Test
    void contextPathIsRemovedFromPath() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/app/healthcheck");
        req.setContextPath("/app");

        assertThat(factory.create(req).path()).isEqualTo("/healthcheck");
    }

    @Test
    void pathIsDecodedAndStrippedOfMatrixContent() {
        assertThat(factory.create(new MockHttpServletRequest("GET", "/d%61ta")).path()).isEqualTo("/data");
        assertThat(factory.create(new MockHttpServletRequest("GET", "/data;v=1")).path()).isEqualTo("/data");
        assertThat(factory.create(new MockHttpServletRequest("GET", "/data;jsessionid=x/items")).path())
                .isEqualTo("/data/items");
    }
}
