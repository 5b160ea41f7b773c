package com.github.dimitryivaniuta.gatekeeper.pipeline;

import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.auth.IpAuthorizer;
import com.github.dimitryivaniuta.gatekeeper.auth.PublicRoutes;
import com.github.dimitryivaniuta.gatekeeper.auth.TokenAuthorizer;
import com.github.dimitryivaniuta.gatekeeper.directory.DirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.directory.LookupOutcome;
import com.github.dimitryivaniuta.gatekeeper.host.HostGate;
import com.github.dimitryivaniuta.gatekeeper.host.HostValidator;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.support.TestRequests;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GatekeeperPipelineTest {

    private final DirectoryLookup directory = mock(DirectoryLookup.class);
    private final AuditLogger audit = mock(AuditLogger.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PublicRoutes publicRoutes = new PublicRoutes("", List.of("/", "/healthcheck"));

    private final Gate edge = new StubGate("rate_limit", GatekeeperState.EDGE_LIMITED,
            GateDecision.allow(Map.of("X-RateLimit-Limit", "60")));

    private GatekeeperPipeline pipeline(Gate rateLimit) {
        return new GatekeeperPipeline(
                rateLimit,
                new HostGate(new HostValidator(List.of("localhost")), audit),
                new IpAuthorizer(true, publicRoutes, directory, audit),
                new TokenAuthorizer(true, publicRoutes, directory, audit),
                audit,
                new GatekeeperMetrics(registry));
    }

    @Test
    void admittedRequestVisitsEveryStateInOrder() {
        when(directory.ipAddressStatus("10.0.0.1")).thenReturn(LookupOutcome.ACTIVE);
        when(directory.tokenStatus("t")).thenReturn(LookupOutcome.ACTIVE);

        PipelineOutcome out = pipeline(edge).admit(TestRequests.withHeaders("/data", headers("localhost", "t")));

        assertThat(out.admitted()).isTrue();
        assertThat(out.rejectedBy()).isNull();
        assertThat(out.trail()).containsExactly(
                GatekeeperState.ENTERED,
                GatekeeperState.EDGE_LIMITED,
                GatekeeperState.HOST_CHECKED,
                GatekeeperState.IP_CHECKED,
                GatekeeperState.TOKEN_CHECKED,
                GatekeeperState.ADMITTED);
        assertThat(out.responseHeaders()).containsEntry("X-RateLimit-Limit", "60");
    }

    @Test
    void hostRejectionShortCircuitsBeforeDirectory() {
        PipelineOutcome out = pipeline(edge).admit(
                TestRequests.get("/data").host("evil.com").headers(headers("evil.com", "t")).build());

        assertThat(out.state()).isEqualTo(GatekeeperState.REJECTED);
        assertThat(out.rejectedBy()).isEqualTo("host");
        assertThat(out.decision().reason()).isEqualTo(RejectionReason.INVALID_HOST);
        assertThat(out.trail()).containsExactly(
                GatekeeperState.ENTERED, GatekeeperState.EDGE_LIMITED, GatekeeperState.REJECTED);
        assertThat(out.responseHeaders()).containsEntry("X-RateLimit-Limit", "60");
        verifyNoInteractions(directory);
        assertThat(registry.counter("gatekeeper_rejections_total", "gate", "host", "reason", "invalid_host").count())
                .isEqualTo(1.0);
    }

    @Test
    void rateLimitRejectionSkipsAllLaterGates() {
        Gate limited = new StubGate("rate_limit", GatekeeperState.EDGE_LIMITED,
                GateDecision.rateLimited(Map.of("Retry-After", "30"), 30));

        PipelineOutcome out = pipeline(limited).admit(TestRequests.get("/data").host("evil.com").build());

        assertThat(out.decision().reason()).isEqualTo(RejectionReason.RATE_LIMITED);
        assertThat(out.trail()).containsExactly(GatekeeperState.ENTERED, GatekeeperState.REJECTED);
        verifyNoInteractions(directory);
        verify(audit, never()).rejection(any(), any(), anyString());
    }

    @Test
    void ipRejectionSkipsTokenLookup() {
        when(directory.ipAddressStatus("10.0.0.1")).thenReturn(LookupOutcome.NOT_FOUND);

        PipelineOutcome out = pipeline(edge).admit(TestRequests.withHeaders("/data", headers("localhost", "t")));

        assertThat(out.rejectedBy()).isEqualTo("ip");
        verify(directory, never()).tokenStatus(anyString());
    }

    @Test
    void throwingGateIsTreatedAsUnavailable() {
        Gate broken = new StubGate("rate_limit", GatekeeperState.EDGE_LIMITED, null) {
            @Override
            public GateDecision evaluate(GateRequest request) {
                throw new IllegalStateException("boom");
            }
        };

        PipelineOutcome out = pipeline(broken).admit(TestRequests.get("/data").build());

        assertThat(out.decision().reason()).isEqualTo(RejectionReason.UNAVAILABLE);
        verify(audit).gateFailure(any(), eq("rate_limit"), any(IllegalStateException.class));
    }

    private static HttpHeaders headers(String host, String token) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.HOST, host);
        h.set(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        return h;
    }

    private static class StubGate implements Gate {
        private final String name;
        private final GatekeeperState state;
        private final GateDecision decision;

        StubGate(String name, GatekeeperState state, GateDecision decision) {
            this.name = name;
            this.state = state;
            this.decision = decision;
        }

        @Override
        public GatekeeperState passedState() {
            return state;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public GateDecision evaluate(GateRequest request) {
            return decision;
        }
    }
}
