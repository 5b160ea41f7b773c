package com.github.dimitryivaniuta.gatekeeper.web;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIpResolverTest {

    @Test
    void withoutTrustedProxiesFirstForwardedHopWins() {
        ClientIpResolver r = new ClientIpResolver(List.of());

        assertThat(r.resolve("203.0.113.7, 10.0.0.2", "198.51.100.1", "10.0.0.3")).isEqualTo("203.0.113.7");
    }

    @Test
    void trustedProxiesAreSkippedFromTheRight() {
        ClientIpResolver r = new ClientIpResolver(List.of("10.0.0.2", "10.0.0.3"));

        // the left-most hop is client-supplied and can be spoofed
        assertThat(r.resolve("1.1.1.1, 203.0.113.7, 10.0.0.2, 10.0.0.3", null, "10.0.0.3"))
                .isEqualTo("203.0.113.7");
    }

    @Test
    void allTrustedHopsFallBackToLeftmost() {
        ClientIpResolver r = new ClientIpResolver(List.of("10.0.0.2"));

        assertThat(r.resolve("10.0.0.2", null, "10.0.0.9")).isEqualTo("10.0.0.2");
    }

    @Test
    void fallsBackToRealIpThenRemoteAddressThenUnknown() {
        ClientIpResolver r = new ClientIpResolver(null);

        assertThat(r.resolve(" ", "198.51.100.1", "10.0.0.3")).isEqualTo("198.51.100.1");
        assertThat(r.resolve(null, null, "10.0.0.3")).isEqualTo("10.0.0.3");
        assertThat(r.resolve(null, "", null)).isEqualTo(ClientIpResolver.UNKNOWN);
    }
}
