package com.github.dimitryivaniuta.gatekeeper.ratelimit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;
import java.util.Objects;

/**
 * {@link CounterStore} on Redis. INCR, the first-hit EXPIRE, the TTL read and the expiry repair all
 * run inside one server-side Lua script ({@code scripts/rate_limit.lua}); there is no client-side
 * increment-then-expire sequence.
 */
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redis;

    @SuppressWarnings("rawtypes")
    private final RedisScript<List> script;

    @SuppressWarnings("rawtypes")
    public RedisCounterStore(StringRedisTemplate redis, RedisScript<List> script) {
        this.redis = Objects.requireNonNull(redis, "redis must not be null");
        this.script = Objects.requireNonNull(script, "script must not be null");
    }

    @Override
    public WindowCounter incrementInWindow(String key, int windowSeconds) {
        List<?> reply;
        try {
            reply = redis.execute(script, List.of(key), String.valueOf(windowSeconds));
        } catch (RuntimeException ex) {
            throw new CounterStoreException("Counter store call failed for key=" + key, ex);
        }
        if (reply == null || reply.size() < 2) {
            throw new CounterStoreException("Unexpected counter script reply for key=" + key + ": " + reply);
        }
        return new WindowCounter(toLong(reply.get(0), key), toLong(reply.get(1), key));
    }

    private static long toLong(Object v, String key) {
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new CounterStoreException("Non-numeric counter script reply for key=" + key, ex);
            }
        }
        throw new CounterStoreException("Non-numeric counter script reply for key=" + key + ": " + v);
    }
}
