package com.taskloop.core.state;

import java.time.Instant;

/**
 * A task the loop stopped retrying.
 *
 * @param blockedAt when the attempt limit was reached
 * @param attempts  failed iterations counted against the task
 * @param reason    why the last attempt failed
 */
public record BlockedTask(Instant blockedAt, int attempts, String reason) {
}
