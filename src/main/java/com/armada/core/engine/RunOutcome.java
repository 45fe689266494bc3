package com.armada.core.engine;

import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.RunState;
import com.armada.core.model.RunStatus;
import com.armada.core.model.RunSummary;

import java.nio.file.Path;

/**
 * Terminal result of one driver invocation.
 *
 * @param runId   run identifier
 * @param status  terminal run status; null for a dry run
 * @param summary item counts against the plan
 * @param plan    the plan that was executed or described
 * @param state   final run state; for a dry run the existing state, possibly null
 * @param report  report written by the finalizer, or null
 * @param dryRun  whether this was a dry run
 */
public record RunOutcome(
    String runId,
    RunStatus status,
    RunSummary summary,
    ExecutionPlan plan,
    RunState state,
    Path report,
    boolean dryRun
) {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_PARTIAL = 2;
    public static final int EXIT_INTERRUPTED = 130;

    public boolean isSuccess() {
        return dryRun || (status == RunStatus.COMPLETED && summary.allCompleted());
    }

    /** 0 success, 2 completed with failed items, 1 fatal, 130 interrupted. */
    public int exitCode() {
        if (dryRun) {
            return EXIT_SUCCESS;
        }
        return switch (status) {
            case COMPLETED -> summary.allCompleted() ? EXIT_SUCCESS : EXIT_PARTIAL;
            case INTERRUPTED -> EXIT_INTERRUPTED;
            case FATAL_ERROR, INITIALIZED, RUNNING -> EXIT_FATAL;
        };
    }
}
