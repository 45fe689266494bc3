package com.armada.core.scheduler;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter, used to pace retry passes within a wave.
 *
 * <pre>
 * raw   = min(base * 2^(attempt-1), max)
 * delay = clamp(raw * (1 + jitter * u), 1s, max)    u uniform in [-1, 1)
 * </pre>
 *
 * The delay is rounded to whole seconds. With the defaults (5s base, 300s max, 0.2 jitter)
 * attempt 1 waits 4-6s, attempt 2 waits 8-12s, and from attempt 7 on the cap applies.
 */
public class BackoffPolicy {

    private static final Duration FLOOR = Duration.ofSeconds(1);

    private final Duration base;
    private final Duration max;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     * @throws IllegalArgumentException if base is not positive, max is below base, or jitter
     *                                  is outside [0, 1)
     */
    public BackoffPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive (current: " + base + ")");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base (base: " + base + ", max: " + max + ")");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0.0, 1.0) (current: " + jitter + ")");
        }
        this.base = base;
        this.max = max;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * @param attempt 1-based attempt number
     * @throws IllegalArgumentException if attempt is not positive
     */
    public Duration delay(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long maxMs = max.toMillis();
        long rawMs = base.toMillis();
        for (int i = 1; i < attempt && rawMs < maxMs; i++) {
            rawMs = Math.min(rawMs * 2, maxMs);
        }
        double u = random.getAsDouble() * 2.0 - 1.0;
        long jittered = Math.round(rawMs * (1.0 + jitter * u));
        long seconds = Math.round(jittered / 1000.0);
        long bounded = Math.max(FLOOR.toSeconds(), Math.min(seconds * 1000L, maxMs) / 1000L);
        return Duration.ofSeconds(bounded);
    }

    public Duration base() {
        return base;
    }

    public Duration max() {
        return max;
    }

    public double jitter() {
        return jitter;
    }
}
