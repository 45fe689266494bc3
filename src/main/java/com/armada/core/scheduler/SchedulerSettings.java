package com.armada.core.scheduler;

import java.time.Duration;

/**
 * Per-run scheduling limits.
 *
 * @param maxParallel maximum concurrently live items, {@code <= 0} for unbounded
 * @param maxRetries  failed attempts after which an item is no longer re-dispatched
 * @param itemTimeout per-item time limit, zero for none
 */
public record SchedulerSettings(int maxParallel, int maxRetries, Duration itemTimeout) {

    public SchedulerSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 (got " + maxRetries + ")");
        }
        itemTimeout = itemTimeout == null || itemTimeout.isNegative() ? Duration.ZERO : itemTimeout;
    }
}
