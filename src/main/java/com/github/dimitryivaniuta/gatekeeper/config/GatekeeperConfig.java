package com.github.dimitryivaniuta.gatekeeper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditLogger;
import com.github.dimitryivaniuta.gatekeeper.audit.AuditRedactor;
import com.github.dimitryivaniuta.gatekeeper.auth.IpAuthorizer;
import com.github.dimitryivaniuta.gatekeeper.auth.PublicRoutes;
import com.github.dimitryivaniuta.gatekeeper.auth.TokenAuthorizer;
import com.github.dimitryivaniuta.gatekeeper.directory.DirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.host.HostGate;
import com.github.dimitryivaniuta.gatekeeper.host.HostValidator;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import com.github.dimitryivaniuta.gatekeeper.pipeline.GatekeeperPipeline;
import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitGate;
import com.github.dimitryivaniuta.gatekeeper.web.ClientIpResolver;
import com.github.dimitryivaniuta.gatekeeper.web.GateRequestFactory;
import com.github.dimitryivaniuta.gatekeeper.web.GatekeeperFilter;
import com.github.dimitryivaniuta.gatekeeper.web.RejectionResponseWriter;
import com.github.dimitryivaniuta.gatekeeper.web.RequestTraceFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * Wires the admission pipeline. Every setting is read here, once; a malformed host pattern or
 * rate-limit rule fails the context.
 */
@Slf4j
@Configuration
public class GatekeeperConfig {

    public static final int TRACE_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 20;
    public static final int GATEKEEPER_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 30;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuditRedactor auditRedactor(GatekeeperProperties props) {
        GatekeeperProperties.Audit audit = props.getAudit();
        return new AuditRedactor(audit.getSensitiveHeaders(), audit.getSensitiveQueryParams());
    }

    @Bean
    public PublicRoutes publicRoutes(GatekeeperProperties props) {
        return new PublicRoutes(props.getBaseUrl(), props.getPublicRoutes());
    }

    @Bean
    public HostValidator hostValidator(GatekeeperProperties props) {
        HostValidator validator = new HostValidator(props.getHosts().getAllowed());
        log.info("Allowed hosts: {}", validator.patterns());
        return validator;
    }

    @Bean
    public HostGate hostGate(HostValidator hostValidator, AuditLogger audit) {
        return new HostGate(hostValidator, audit);
    }

    @Bean
    public IpAuthorizer ipAuthorizer(GatekeeperProperties props, PublicRoutes publicRoutes,
                                     DirectoryLookup directory, AuditLogger audit) {
        return new IpAuthorizer(props.getIpAuth().isEnabled(), publicRoutes, directory, audit);
    }

    @Bean
    public TokenAuthorizer tokenAuthorizer(GatekeeperProperties props, PublicRoutes publicRoutes,
                                           DirectoryLookup directory, AuditLogger audit) {
        return new TokenAuthorizer(props.getTokenAuth().isEnabled(), publicRoutes, directory, audit);
    }

    @Bean
    public GatekeeperPipeline gatekeeperPipeline(RateLimitGate rateLimitGate,
                                                 HostGate hostGate,
                                                 IpAuthorizer ipAuthorizer,
                                                 TokenAuthorizer tokenAuthorizer,
                                                 AuditLogger audit,
                                                 GatekeeperMetrics metrics) {
        return new GatekeeperPipeline(rateLimitGate, hostGate, ipAuthorizer, tokenAuthorizer, audit, metrics);
    }

    @Bean
    public GateRequestFactory gateRequestFactory(GatekeeperProperties props) {
        return new GateRequestFactory(new ClientIpResolver(props.getTrustedProxies()), props.getAudit().getMaxBodyChars());
    }

    @Bean
    public FilterRegistrationBean<RequestTraceFilter> requestTraceFilter(GatekeeperProperties props,
                                                                          GateRequestFactory factory,
                                                                          AuditLogger audit) {
        FilterRegistrationBean<RequestTraceFilter> reg = new FilterRegistrationBean<>(
                new RequestTraceFilter(props.getAudit().isTraceEnabled(), factory, audit));
        reg.setOrder(TRACE_FILTER_ORDER);
        return reg;
    }

    @Bean
    public FilterRegistrationBean<GatekeeperFilter> gatekeeperFilter(GatekeeperPipeline pipeline,
                                                                     GateRequestFactory factory,
                                                                     ObjectMapper objectMapper) {
        FilterRegistrationBean<GatekeeperFilter> reg = new FilterRegistrationBean<>(
                new GatekeeperFilter(pipeline, factory, new RejectionResponseWriter(objectMapper)));
        reg.setOrder(GATEKEEPER_FILTER_ORDER);
        return reg;
    }
}
