package com.github.dimitryivaniuta.gatekeeper.audit;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditRedactorTest {

    private final AuditRedactor redactor = new AuditRedactor(
            List.of("Authorization", "x-api-key", "cookie"),
            List.of("api_key", "access_token"));

    @Test
    void sensitiveValuesAreReplacedCaseInsensitively() {
        HttpHeaders h = new HttpHeaders();
        h.set("AUTHORIZATION", "Bearer secret");
        h.set("X-Api-Key", "secret-key");
        h.add("Cookie", "a=1");
        h.add("Cookie", "b=2");
        h.set("Accept", "application/json");

        Map<String, String> out = redactor.redact(h);

        assertThat(out).containsEntry("AUTHORIZATION", AuditRedactor.REDACTED)
                .containsEntry("X-Api-Key", AuditRedactor.REDACTED)
                .containsEntry("Cookie", AuditRedactor.REDACTED)
                .containsEntry("Accept", "application/json");
        assertThat(out.values()).noneMatch(v -> v.contains("secret"));
    }

    @Test
    void sourceHeadersAreLeftUntouched() {
        HttpHeaders h = new HttpHeaders();
        h.set("Authorization", "Bearer secret");

        redactor.redact(h);

        assertThat(h.getFirst("Authorization")).isEqualTo("Bearer secret");
    }

    @Test
    void multipleValuesAreJoined() {
        HttpHeaders h = new HttpHeaders();
        h.add("Via", "1.1 a");
        h.add("Via", "1.1 b");

        assertThat(redactor.redact(h)).containsEntry("Via", "1.1 a, 1.1 b");
    }

    @Test
    void sensitiveQueryParametersAreRedacted() {
        assertThat(redactor.redactQuery("page=2&API_KEY=s3cret&api%5Fkey=s3cret&access_token=t&q=x"))
                .isEqualTo("page=2&API_KEY=[REDACTED]&api%5Fkey=[REDACTED]&access_token=[REDACTED]&q=x");
        assertThat(redactor.redactQuery("api_key")).isEqualTo("api_key=[REDACTED]");
        assertThat(redactor.redactQuery(null)).isNull();
    }

    @Test
    void routeJoinsPathAndRedactedQuery() {
        assertThat(redactor.route("/data", "api_key=s3cret")).isEqualTo("/data?api_key=[REDACTED]");
        assertThat(redactor.route("/data", null)).isEqualTo("/data");
        assertThat(redactor.route("/data", "")).isEqualTo("/data");
    }
}
