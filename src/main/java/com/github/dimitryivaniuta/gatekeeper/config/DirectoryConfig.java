package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.directory.AllowedIpAddressRepository;
import com.github.dimitryivaniuta.gatekeeper.directory.ApiTokenRepository;
import com.github.dimitryivaniuta.gatekeeper.directory.JpaDirectoryLookup;
import com.github.dimitryivaniuta.gatekeeper.directory.TokenHashService;
import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DirectoryConfig {

    @Bean
    public TokenHashService tokenHashService(GatekeeperProperties props) {
        GatekeeperProperties.TokenAuth t = props.getTokenAuth();
        return new TokenHashService(t.getPepper(), t.getHashAlgorithm());
    }

    @Bean
    public JpaDirectoryLookup directoryLookup(AllowedIpAddressRepository ipRepo,
                                              ApiTokenRepository tokenRepo,
                                              TokenHashService tokenHashService,
                                              CacheManager cacheManager,
                                              GatekeeperMetrics metrics,
                                              GatekeeperProperties props) {
        return new JpaDirectoryLookup(ipRepo, tokenRepo, tokenHashService, cacheManager, metrics,
                props.getDirectory().getCacheTtlSeconds());
    }
}
