package com.taskloop.core.ratelimit;

import com.taskloop.core.tracker.RateLimitExceededException;
import com.taskloop.core.tracker.TrackerNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Tracks remaining-quota and reset signals from API responses and decides how long to wait
 * before the next call.
 * <p>
 * Below the low-water mark each call is preceded by an exponential, capped, jittered delay
 * drawn from the {@link RetryBudget}. A hard rejection waits for the reported reset only when
 * that wait fits the budget's patience; otherwise {@link RateLimitExceededException} is raised
 * so the caller can fall back to cached data. Calls made inside {@link #compensating} wait
 * for any reset up to {@link #MAX_COMPENSATION_WAIT} regardless of patience.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /** Longest reset a compensating call waits for; GitHub quota windows are one hour. */
    public static final Duration MAX_COMPENSATION_WAIT = Duration.ofHours(1);

    private final int lowWaterMark;
    private final RetryBudget budget;
    private final Clock clock;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    private final ThreadLocal<Boolean> compensating = ThreadLocal.withInitial(() -> false);

    private RateLimitState state = RateLimitState.UNKNOWN;
    private int lowStreak;

    public RateLimiter(int lowWaterMark, RetryBudget budget, Clock clock, Sleeper sleeper, DoubleSupplier random) {
        this.lowWaterMark = lowWaterMark;
        this.budget = budget;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    public synchronized RateLimitState state() {
        return state;
    }

    public RetryBudget budget() {
        return budget;
    }

    /**
     * Runs {@code action} so that its requests wait out a hard limit instead of failing fast.
     * Used for undo steps, which must reach the server even when the quota ran out mid-update.
     */
    public <T> T compensating(Supplier<T> action) {
        if (compensating.get()) {
            return action.get();
        }
        compensating.set(true);
        try {
            return action.get();
        } finally {
            compensating.set(false);
        }
    }

    /**
     * Called before every request. Returns the delay that was inserted, possibly zero.
     *
     * @throws RateLimitExceededException when the quota is exhausted and the reset is beyond patience
     */
    public Duration beforeRequest() {
        RateLimitState current = state();
        Instant now = clock.instant();
        if (current.isExhausted() && current.resetAt() != null && current.resetAt().isAfter(now)) {
            Duration untilReset = Duration.between(now, current.resetAt());
            return awaitReset(untilReset, "quota exhausted");
        }
        if (!current.isBelow(lowWaterMark)) {
            synchronized (this) {
                lowStreak = 0;
            }
            return Duration.ZERO;
        }
        Duration delay;
        synchronized (this) {
            delay = budget.delayFor(lowStreak++, random);
        }
        log.debug("Quota low (remaining={}, low-water={}); pausing {} ms",
                current.remaining() == null ? "unknown" : current.remaining(), lowWaterMark, delay.toMillis());
        pause(delay);
        return delay;
    }

    /**
     * Records the quota signals of a response. Absent values keep what was known before.
     */
    public synchronized void update(Integer remaining, Instant resetAt) {
        state = new RateLimitState(
                remaining != null ? remaining : state.remaining(),
                resetAt != null ? resetAt : state.resetAt(),
                state.lastBackoff());
    }

    /**
     * Handles a hard rejection (403/429 with exhausted quota or a Retry-After).
     *
     * @param retryAfter server-provided wait, nullable
     * @return the time waited
     * @throws RateLimitExceededException when the wait exceeds the budget's patience
     */
    public Duration onHardLimit(Duration retryAfter) {
        Instant now = clock.instant();
        Duration wait;
        if (retryAfter != null) {
            wait = retryAfter;
        } else {
            Instant resetAt = state().resetAt();
            wait = resetAt != null && resetAt.isAfter(now) ? Duration.between(now, resetAt) : budget.delayFor(0, random);
        }
        synchronized (this) {
            state = new RateLimitState(0, now.plus(wait), state.lastBackoff());
        }
        return awaitReset(wait, "hard rate limit");
    }

    /**
     * Delay before retry number {@code attempt} (1-based) after a transport failure or 5xx.
     */
    public Duration retryDelay(int attempt) {
        Duration delay = budget.delayFor(Math.max(0, attempt - 1), random);
        pause(delay);
        return delay;
    }

    private Duration awaitReset(Duration wait, String reason) {
        Instant resetAt = clock.instant().plus(wait);
        if (compensating.get()) {
            if (wait.compareTo(MAX_COMPENSATION_WAIT) > 0) {
                throw new RateLimitExceededException(
                        "GitHub API rate limit (%s): reset in %ds is too far out to undo changes"
                                .formatted(reason, wait.toSeconds()),
                        resetAt);
            }
        } else if (!budget.fitsPatience(wait)) {
            throw new RateLimitExceededException(
                    "GitHub API rate limit (%s): reset in %ds exceeds patience of %ds"
                            .formatted(reason, wait.toSeconds(), budget.patience().toSeconds()),
                    resetAt);
        }
        log.warn("GitHub API {}; waiting {}s for reset", reason, wait.toSeconds());
        pause(wait);
        synchronized (this) {
            // the window has rolled over; quota is unknown until the next response
            state = new RateLimitState(null, null, state.lastBackoff());
        }
        return wait;
    }

    private void pause(Duration delay) {
        synchronized (this) {
            state = new RateLimitState(state.remaining(), state.resetAt(), delay);
        }
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerNetworkException("Interrupted while backing off", e);
        }
    }
}
