package com.github.dimitryivaniuta.gatekeeper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration of the admission pipeline.
 *
 * <p>Bound once when the context starts; gates copy what they need in their constructors and never
 * read it again. Any binding or validation failure aborts startup.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gatekeeper")
public class GatekeeperProperties {

    /** Optional prefix (e.g. "/api") stripped from the path before public-route matching. */
    private String baseUrl = "";

    /** Routes exempt from IP and token authorization. Shared by both gates. */
    @NotEmpty
    private List<String> publicRoutes = new ArrayList<>(List.of(
            "/",
            "/healthcheck",
            "/actuator/health",
            "/actuator/prometheus"
    ));

    /** Proxy addresses skipped when walking X-Forwarded-For from the right. */
    private List<String> trustedProxies = new ArrayList<>();

    @Valid
    private Hosts hosts = new Hosts();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    private IpAuth ipAuth = new IpAuth();

    @Valid
    private TokenAuth tokenAuth = new TokenAuth();

    @Valid
    private Directory directory = new Directory();

    @Valid
    private Audit audit = new Audit();

    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Hosts {
        /** Exact host, bare domain ("example.com") or wildcard domain (".example.com"). */
        @NotEmpty
        private List<String> allowed = new ArrayList<>(List.of("localhost"));
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;

        @Min(1)
        private int defaultLimit = 60;

        @Min(1)
        @Max(86_400)
        private int defaultWindowSeconds = 60;

        @NotBlank
        private String keyPrefix = "rl";

        /**
         * Key requests by the resolved client address (forwarded headers) instead of the raw
         * connection address.
         */
        private boolean useForwardedIdentity = false;

        @Valid
        private List<Rule> rules = new ArrayList<>();

        @Valid
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        @Getter
        @Setter
        public static class Rule {
            /** Ant-style path pattern, e.g. "/data/**". */
            @NotBlank
            private String pattern;

            @Min(1)
            private int limit;

            @Min(1)
            @Max(86_400)
            private int windowSeconds;
        }

        @Getter
        @Setter
        public static class CircuitBreaker {
            @Min(1)
            @Max(100)
            private int failureRateThreshold = 50;

            @Min(1)
            private int slidingWindowSize = 20;

            @Min(1)
            private int waitInOpenStateSeconds = 10;
        }
    }

    @Getter
    @Setter
    public static class IpAuth {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class TokenAuth {
        private boolean enabled = true;

        /** HMAC key for token hashes. Required when the token gate is wired; never stored in the database. */
        private String pepper = "";

        @NotBlank
        private String hashAlgorithm = "HmacSHA256";
    }

    @Getter
    @Setter
    public static class Directory {
        /** TTL of cached lookup answers; 0 disables the cache. */
        @Min(0)
        @Max(3_600)
        private int cacheTtlSeconds = 30;
    }

    @Getter
    @Setter
    public static class Audit {
        private boolean traceEnabled = true;

        @NotEmpty
        private List<String> sensitiveHeaders = new ArrayList<>(List.of(
                "authorization",
                "cookie",
                "set-cookie",
                "x-api-key",
                "x-auth-token",
                "x-access-token",
                "x-refresh-token",
                "proxy-authorization"
        ));

        private List<String> sensitiveQueryParams = new ArrayList<>(List.of(
                "api_key",
                "apikey",
                "access_token",
                "token",
                "password",
                "secret"
        ));

        @Min(0)
        private int maxBodyChars = 20_000;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        private List<String> allowedHeaders = new ArrayList<>(List.of(
                "Content-Type",
                "Authorization",
                "X-Api-Key",
                "X-Correlation-Id",
                "X-Requested-With",
                "Accept",
                "Origin"
        ));
        private boolean allowCredentials = true;
    }
}
