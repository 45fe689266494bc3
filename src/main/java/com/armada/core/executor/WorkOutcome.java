package com.armada.core.executor;

import com.armada.core.classify.ErrorClassifier;

import java.time.Duration;

/**
 * Uninterpreted result of one item execution.
 *
 * @param itemId    the item executed
 * @param success   whether the unit of work reported success
 * @param rawOutput captured output, never null
 * @param timedOut  true if the per-item timeout elapsed
 * @param exitCode  exit code reported by the unit of work, {@link ErrorClassifier#TIMEOUT_EXIT_CODE}
 *                  on timeout
 * @param elapsed   wall-clock duration
 * @param interrupted the unit of work stopped early on a shutdown request
 */
public record WorkOutcome(
    String itemId,
    boolean success,
    String rawOutput,
    boolean timedOut,
    int exitCode,
    Duration elapsed,
    boolean interrupted
) {
    public WorkOutcome {
        rawOutput = rawOutput == null ? "" : rawOutput;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public WorkOutcome(String itemId, boolean success, String rawOutput, boolean timedOut, int exitCode,
                       Duration elapsed) {
        this(itemId, success, rawOutput, timedOut, exitCode, elapsed, false);
    }

    static WorkOutcome of(String itemId, WorkResult result, Duration elapsed) {
        return new WorkOutcome(itemId, result.success(), result.output(), false, result.exitCode(), elapsed,
                result.interrupted());
    }

    static WorkOutcome timeout(String itemId, Duration limit, Duration elapsed) {
        return new WorkOutcome(itemId, false, "Timed out after " + limit.toMinutes() + " minute(s)",
                true, ErrorClassifier.TIMEOUT_EXIT_CODE, elapsed);
    }

    static WorkOutcome error(String itemId, Throwable cause, Duration elapsed) {
        String text = cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        return new WorkOutcome(itemId, false, text, false, 1, elapsed);
    }
}
