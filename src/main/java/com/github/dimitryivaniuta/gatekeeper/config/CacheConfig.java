package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.gatekeeper.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Local Caffeine caches for directory lookups. TTL per cache comes from the ":ttl=NN" name suffix
 * (see {@link TtlCaffeineCacheManager}); every instance keeps its own cache.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(50_000)
                        .recordStats()
        );
    }
}
