package com.taskloop.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * One cached snapshot.
 *
 * @param key                repo + filter signature
 * @param payload            the cached items
 * @param fetchedAt          when the payload was last confirmed by the remote side
 * @param ttlSeconds         maximum age before a refresh is attempted
 * @param etag               entity tag of the response that produced the payload, nullable
 * @param rateLimitRemaining quota reported with that response, nullable
 * @param rateLimitResetAt   quota reset reported with that response, nullable
 * @param <T>                payload item type
 */
public record CacheEntry<T>(
    String key,
    List<T> payload,
    Instant fetchedAt,
    long ttlSeconds,
    String etag,
    Integer rateLimitRemaining,
    Instant rateLimitResetAt
) {

    public CacheEntry {
        payload = payload != null ? List.copyOf(payload) : List.of();
    }

    public boolean isExpired(Instant now) {
        return Duration.between(fetchedAt, now).getSeconds() >= ttlSeconds;
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    /**
     * Same payload, confirmed fresh at {@code now} (e.g. after a 304).
     */
    public CacheEntry<T> renewed(Instant now, Integer remaining, Instant resetAt) {
        return new CacheEntry<>(key, payload, now, ttlSeconds, etag, remaining, resetAt);
    }

    /**
     * Local write-through edit that keeps the fetch time and entity tag.
     */
    public CacheEntry<T> withPayload(UnaryOperator<List<T>> edit) {
        return new CacheEntry<>(key, edit.apply(payload), fetchedAt, ttlSeconds, etag,
                rateLimitRemaining, rateLimitResetAt);
    }
}
