package com.armada.core.scheduler;

import java.time.Duration;

/**
 * Waits out a backoff delay. Implementations may return early, e.g. when shutdown is requested.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
