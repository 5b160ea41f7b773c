package com.github.dimitryivaniuta.gatekeeper.directory;

import com.github.dimitryivaniuta.gatekeeper.metrics.GatekeeperMetrics;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DirectoryLookup} over the allow-list tables.
 *
 * <p>Found and not-found answers are cached for a short TTL. Failures are never cached and surface as
 * {@link DirectoryUnavailableException}. Nothing here writes to the directory.
 */
@Slf4j
public class JpaDirectoryLookup implements DirectoryLookup {

    static final String IP_CACHE_PREFIX = "directoryIp";
    static final String TOKEN_CACHE_PREFIX = "directoryToken";

    private final AllowedIpAddressRepository ipRepo;
    private final ApiTokenRepository tokenRepo;
    private final TokenHashService hashService;
    private final CacheManager cacheManager;
    private final GatekeeperMetrics metrics;
    private final String ipCacheName;
    private final String tokenCacheName;

    public JpaDirectoryLookup(AllowedIpAddressRepository ipRepo,
                              ApiTokenRepository tokenRepo,
                              TokenHashService hashService,
                              CacheManager cacheManager,
                              GatekeeperMetrics metrics,
                              int cacheTtlSeconds) {
        this.ipRepo = ipRepo;
        this.tokenRepo = tokenRepo;
        this.hashService = hashService;
        this.cacheManager = cacheManager;
        this.metrics = metrics;
        this.ipCacheName = cacheTtlSeconds > 0 ? IP_CACHE_PREFIX + ":ttl=" + cacheTtlSeconds : null;
        this.tokenCacheName = cacheTtlSeconds > 0 ? TOKEN_CACHE_PREFIX + ":ttl=" + cacheTtlSeconds : null;
    }

    @Override
    public LookupOutcome ipAddressStatus(String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) return LookupOutcome.NOT_FOUND;
        String ip = ipAddress.trim();
        return cached(ipCacheName, ip, "ip", () -> ipRepo.findByIpAddress(ip)
                .map(AllowedIpAddress::getStatus)
                .map(LookupOutcome::of)
                .orElse(LookupOutcome.NOT_FOUND));
    }

    @Override
    public LookupOutcome tokenStatus(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) return LookupOutcome.NOT_FOUND;
        String hash = hashService.hash(rawToken);
        return cached(tokenCacheName, hash, "token", () -> tokenRepo.findByTokenHash(hash)
                .map(ApiToken::getStatus)
                .map(LookupOutcome::of)
                .orElse(LookupOutcome.NOT_FOUND));
    }

    /** Drops a cached IP answer, e.g. after an admin status change. */
    public void evictIp(String ipAddress) {
        cache(ipCacheName).ifPresent(c -> c.evict(ipAddress.trim()));
    }

    /** Drops a cached token answer by stored hash. */
    public void evictTokenHash(String tokenHash) {
        cache(tokenCacheName).ifPresent(c -> c.evict(tokenHash));
    }

    private LookupOutcome cached(String cacheName, String key, String kind, Supplier<LookupOutcome> loader) {
        Optional<Cache> cache = cache(cacheName);
        if (cache.isPresent()) {
            LookupOutcome hit = cache.get().get(key, LookupOutcome.class);
            if (hit != null) return hit;
        }

        LookupOutcome loaded = load(kind, loader);
        cache.ifPresent(c -> c.put(key, loaded));
        return loaded;
    }

    private LookupOutcome load(String kind, Supplier<LookupOutcome> loader) {
        try {
            LookupOutcome outcome = loader.get();
            metrics.directoryLookup(kind, outcome.name().toLowerCase(Locale.ROOT));
            return outcome;
        } catch (DataAccessException | TransactionException | PersistenceException ex) {
            metrics.directoryLookup(kind, "unavailable");
            log.error("Directory {} lookup failed: {}", kind, ex.toString());
            throw new DirectoryUnavailableException("Directory " + kind + " lookup failed", ex);
        }
    }

    private Optional<Cache> cache(String name) {
        return (name == null) ? Optional.empty() : Optional.ofNullable(cacheManager.getCache(name));
    }
}
