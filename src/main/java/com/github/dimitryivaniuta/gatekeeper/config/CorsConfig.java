package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.ratelimit.RateLimitGate;
import com.github.dimitryivaniuta.gatekeeper.web.RequestContextKeys;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS runs ahead of the gatekeeper: preflight requests are answered here and never reach the gates.
 */
@Configuration
public class CorsConfig {

    public static final int CORS_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 15;

    @Bean
    CorsConfigurationSource corsConfigurationSource(GatekeeperProperties props) {
        GatekeeperProperties.Cors cors = props.getCors();
        CorsConfiguration c = new CorsConfiguration();
        c.setAllowedOrigins(List.copyOf(cors.getAllowedOrigins()));
        c.setAllowedMethods(List.copyOf(cors.getAllowedMethods()));
        c.setAllowedHeaders(List.copyOf(cors.getAllowedHeaders()));
        c.setExposedHeaders(List.of(
                HttpHeaders.RETRY_AFTER,
                RequestContextKeys.CORRELATION_ID_HEADER,
                RateLimitGate.LIMIT_HEADER,
                RateLimitGate.REMAINING_HEADER,
                RateLimitGate.RESET_HEADER
        ));
        c.setAllowCredentials(cors.isAllowCredentials());
        c.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", c);
        return src;
    }

    @Bean
    FilterRegistrationBean<CorsFilter> corsFilterRegistration(CorsConfigurationSource source) {
        FilterRegistrationBean<CorsFilter> reg = new FilterRegistrationBean<>(new CorsFilter(source));
        reg.setOrder(CORS_FILTER_ORDER);
        return reg;
    }
}
