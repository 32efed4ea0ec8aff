package com.taskloop.core.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Last quota signals seen from the remote API. Process-local, never persisted.
 *
 * @param remaining   requests left in the current window, null while unknown
 * @param resetAt     when the window resets, null while unknown
 * @param lastBackoff most recent inserted delay
 */
public record RateLimitState(Integer remaining, Instant resetAt, Duration lastBackoff) {

    public static final RateLimitState UNKNOWN = new RateLimitState(null, null, Duration.ZERO);

    public boolean isKnown() {
        return remaining != null;
    }

    /**
     * Unknown quota counts as low.
     */
    public boolean isBelow(int lowWaterMark) {
        return remaining == null || remaining < lowWaterMark;
    }

    public boolean isExhausted() {
        return remaining != null && remaining <= 0;
    }
}
