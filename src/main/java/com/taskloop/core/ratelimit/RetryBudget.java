package com.taskloop.core.ratelimit;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * How much retrying and waiting a single network-issuing call may do.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay   delay for the first backoff step
 * @param maxDelay    cap applied before jitter
 * @param jitter      fraction in [0, 1); the delay is scaled by a random factor in {@code 1 ± jitter}
 * @param patience    longest single wait for a hard rate-limit reset before giving up
 */
public record RetryBudget(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter, Duration patience) {

    public RetryBudget {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative() || patience.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public static RetryBudget none() {
        return new RetryBudget(1, Duration.ZERO, Duration.ZERO, 0, Duration.ZERO);
    }

    /**
     * {@code min(maxDelay, baseDelay * 2^step) * (1 ± jitter)}.
     *
     * @param step   zero-based backoff step
     * @param random source of uniform values in [0, 1)
     */
    public Duration delayFor(int step, DoubleSupplier random) {
        double exponential = baseDelay.toMillis() * Math.pow(2, Math.max(0, step));
        double bounded = Math.min(maxDelay.toMillis(), exponential);
        double factor = 1 + jitter * (2 * random.getAsDouble() - 1);
        return Duration.ofMillis(Math.max(0, Math.round(bounded * factor)));
    }

    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public boolean fitsPatience(Duration wait) {
        return wait.compareTo(patience) <= 0;
    }
}
