package com.github.dimitryivaniuta.gatekeeper.ratelimit;

/**
 * Counter state observed by one atomic increment.
 *
 * @param count      post-increment request count in the current window
 * @param ttlSeconds seconds until the window's counter expires
 */
public record WindowCounter(long count, long ttlSeconds) {
}
