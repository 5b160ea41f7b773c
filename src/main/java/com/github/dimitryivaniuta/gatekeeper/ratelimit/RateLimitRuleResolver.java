package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import com.github.dimitryivaniuta.gatekeeper.config.GatekeeperProperties;
import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * Maps a request path to its rate-limit rule. Configured rules are tried in order; the first match wins.
 */
public final class RateLimitRuleResolver {

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final List<RateLimitRule> rules;
    private final RateLimitRule fallback;

    public RateLimitRuleResolver(List<RateLimitRule> rules, RateLimitRule fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
        for (RateLimitRule r : this.rules) {
            if (!r.pattern().startsWith("/")) {
                throw new IllegalArgumentException("Rate limit pattern must start with '/': " + r.pattern());
            }
        }
    }

    public static RateLimitRuleResolver from(GatekeeperProperties.RateLimit props) {
        List<RateLimitRule> rules = props.getRules().stream()
                .map(r -> new RateLimitRule(r.getPattern().trim(), r.getLimit(), r.getWindowSeconds()))
                .toList();
        return new RateLimitRuleResolver(rules,
                new RateLimitRule(RateLimitRule.DEFAULT_PATTERN, props.getDefaultLimit(), props.getDefaultWindowSeconds()));
    }

    public RateLimitRule resolve(String path) {
        for (RateLimitRule r : rules) {
            if (matcher.match(r.pattern(), path)) return r;
        }
        return fallback;
    }
}
