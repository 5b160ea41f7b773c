package com.github.dimitryivaniuta.gatekeeper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gatekeeper.directory.TokenHashService;
import com.github.dimitryivaniuta.gatekeeper.infra.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
class GatekeeperIT extends BaseIntegrationTest {

    private static final String ADMIN_TOKEN = "it-admin-token";

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired TokenHashService hashService;

    @BeforeEach
    void seedDirectory() {
        jdbc.update("insert into allowed_ip_address(uuid, ip_address, status) values (?, '127.0.0.1', 'ACTIVE')",
                UUID.randomUUID());
        jdbc.update("insert into api_token(uuid, token_hash, label, status) values (?, ?, 'it-admin', 'ACTIVE')",
                UUID.randomUUID(), hashService.hash(ADMIN_TOKEN));
    }

    @Test
    void healthcheckIsPublic() throws Exception {
        mvc.perform(get("/healthcheck").header("Host", "localhost"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Application Up And Running"))
                .andExpect(header().exists("X-Correlation-Id"))
                .andExpect(header().exists("X-RateLimit-Limit"));
    }

    @Test
    void wildcardHostIsAcceptedAndUnknownHostRejected() throws Exception {
        mvc.perform(get("/healthcheck").header("Host", "api.example.com:8443"))
                .andExpect(status().isOk());

        mvc.perform(get("/healthcheck").header("Host", "example.com"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_host"));
    }

    @Test
    void createdTokenAuthorizesUntilDeactivated() throws Exception {
        MvcResult created = mvc.perform(post("/admin/api-tokens")
                        .header("Host", "localhost")
                        .header("Authorization", "Bearer " + ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"label":"integration"}
                                """))
                .andExpect(status().isCreated())
                .andReturn();

        JsonNode json = om.readTree(created.getResponse().getContentAsString());
        String raw = json.get("token").asText();
        String uuid = json.get("uuid").asText();
        assertThat(raw).isNotBlank();
        assertThat(jdbc.queryForObject("select count(*) from api_token where token_hash = ?", Integer.class, raw))
                .isZero();

        mvc.perform(get("/admin/api-tokens").header("Host", "localhost").header("X-Api-Key", raw))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].token").doesNotExist());

        mvc.perform(patch("/admin/api-tokens/{uuid}/status", uuid)
                        .header("Host", "localhost")
                        .header("Authorization", "Bearer " + ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status":"INACTIVE"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INACTIVE"));

        mvc.perform(get("/admin/api-tokens").header("Host", "localhost").header("X-Api-Key", raw))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));
    }

    @Test
    void missingTokenIs401() throws Exception {
        mvc.perform(get("/admin/allowed-ips").header("Host", "localhost"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void unlistedIpIs403() throws Exception {
        jdbc.update("update allowed_ip_address set status = 'BANNED'");

        mvc.perform(get("/admin/allowed-ips")
                        .header("Host", "localhost")
                        .header("Authorization", "Bearer " + ADMIN_TOKEN))
                .andExpect(status().isForbidden());
    }

    @Test
    void duplicateIpIsConflict() throws Exception {
        mvc.perform(post("/admin/allowed-ips")
                        .header("Host", "localhost")
                        .header("Authorization", "Bearer " + ADMIN_TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"ipAddress":"127.0.0.1"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.correlationId").exists());
    }

    @Test
    void routeClassLimitReturns429WithRetryAfter() throws Exception {
        for (int i = 0; i < 2; i++) {
            mvc.perform(get("/limited/resource")
                            .header("Host", "localhost")
                            .header("Authorization", "Bearer " + ADMIN_TOKEN))
                    .andExpect(header().string("X-RateLimit-Limit", "2"));
        }

        MvcResult third = mvc.perform(get("/limited/resource")
                        .header("Host", "localhost")
                        .header("Authorization", "Bearer " + ADMIN_TOKEN))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("rate_limited"))
                .andReturn();

        int retryAfter = Integer.parseInt(third.getResponse().getHeader("Retry-After"));
        assertThat(retryAfter).isBetween(1, 60);
        assertThat(om.readTree(third.getResponse().getContentAsString()).get("retry_after").asInt())
                .isEqualTo(retryAfter);
    }

    @Test
    void prometheusExposesGatekeeperMeters() throws Exception {
        mvc.perform(get("/healthcheck").header("Host", "localhost")).andExpect(status().isOk());

        mvc.perform(get("/actuator/prometheus").header("Host", "localhost"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("gatekeeper_ratelimit_allowed_total")));
    }
}
