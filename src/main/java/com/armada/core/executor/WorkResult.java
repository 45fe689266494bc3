package com.armada.core.executor;

/**
 * What a {@link UnitOfWork} reports back.
 *
 * @param success     whether the work succeeded
 * @param output      raw textual output used for error classification
 * @param exitCode    process exit code, 0 when not applicable
 * @param interrupted the work stopped early because shutdown was requested; neither a success
 *                    nor a failure
 */
public record WorkResult(boolean success, String output, int exitCode, boolean interrupted) {

    public WorkResult {
        output = output == null ? "" : output;
    }

    public WorkResult(boolean success, String output, int exitCode) {
        this(success, output, exitCode, false);
    }

    public static WorkResult success(String output) {
        return new WorkResult(true, output, 0);
    }

    public static WorkResult failure(String output, int exitCode) {
        return new WorkResult(false, output, exitCode);
    }

    public static WorkResult interrupted(String output, int exitCode) {
        return new WorkResult(false, output, exitCode, true);
    }
}
