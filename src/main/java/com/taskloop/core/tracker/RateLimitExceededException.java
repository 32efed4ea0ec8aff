package com.taskloop.core.tracker;

import java.time.Instant;

/**
 * The remote API rejected the call for quota reasons and the reset lies beyond the
 * caller's patience.
 */
public class RateLimitExceededException extends TrackerNetworkException {

    private final Instant resetAt;

    public RateLimitExceededException(String message, Instant resetAt) {
        super(message);
        this.resetAt = resetAt;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
