package com.armada.core.engine;

import com.armada.core.scheduler.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide shutdown flag shared by every driver, nested ones included.
 *
 * <p>Drivers poll {@link #isRequested()} at wave boundaries and before launching items; backoff
 * waits end early once shutdown is requested. The signal also counts active runs so a shutdown
 * hook can wait for them to persist their final status.
 */
public class ShutdownSignal {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch requested = new CountDownLatch(1);
    private final Object monitor = new Object();
    private int activeRuns;

    public void request() {
        if (requested.getCount() > 0) {
            log.warn("Shutdown requested, finishing in-flight work before stopping");
        }
        requested.countDown();
    }

    public boolean isRequested() {
        return requested.getCount() == 0;
    }

    /**
     * Sleeps for {@code duration} or until shutdown is requested, whichever comes first.
     *
     * @return true if shutdown was requested
     */
    public boolean await(Duration duration) throws InterruptedException {
        return requested.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Sleeper asSleeper() {
        return this::await;
    }

    void runStarted() {
        synchronized (monitor) {
            activeRuns++;
        }
    }

    void runFinished() {
        synchronized (monitor) {
            activeRuns--;
            monitor.notifyAll();
        }
    }

    public int activeRuns() {
        synchronized (monitor) {
            return activeRuns;
        }
    }

    /**
     * Waits until no run is active or {@code timeout} elapses.
     *
     * @return true if every run finished in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (activeRuns > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                monitor.wait(remainingMs);
            }
            return true;
        }
    }
}
