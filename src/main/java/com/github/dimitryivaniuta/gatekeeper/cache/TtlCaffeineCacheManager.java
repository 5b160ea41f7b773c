package com.github.dimitryivaniuta.gatekeeper.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager with per-cache TTL taken from the cache name:
 *
 *   "directoryIp:ttl=30"     -> expireAfterWrite 30 seconds
 *   "directoryToken:ttl=5"   -> expireAfterWrite 5 seconds
 *
 * A name without a valid ":ttl=" suffix gets the base builder's expiry. The full name is the cache
 * identity, so the same base name with two TTLs yields two caches.
 *
 * Caffeine builders are mutable, so a fresh builder is taken from the factory for every cache.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_PATTERN = Pattern.compile("^.+?:ttl=(?<ttl>\\d{1,9})$");
    static final long MIN_TTL_SECONDS = 1;
    static final long MAX_TTL_SECONDS = 60 * 60;

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        // AbstractCacheManager registers the returned cache under its name
        Caffeine<Object, Object> builder = baseBuilderFactory.get();
        OptionalLong ttl = ttlSeconds(name);
        if (ttl.isPresent()) {
            builder = builder.expireAfterWrite(Duration.ofSeconds(ttl.getAsLong()));
        }
        return new CaffeineCache(name, builder.build(), false);
    }

    /** TTL encoded in a cache name, clamped to [1s, 1h]; empty if the name carries none. */
    static OptionalLong ttlSeconds(String name) {
        if (name == null) return OptionalLong.empty();
        Matcher m = TTL_PATTERN.matcher(name.trim());
        if (!m.matches()) return OptionalLong.empty();
        long ttl = Long.parseLong(m.group("ttl"));
        return OptionalLong.of(Math.max(MIN_TTL_SECONDS, Math.min(ttl, MAX_TTL_SECONDS)));
    }
}
