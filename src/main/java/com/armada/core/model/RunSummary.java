package com.armada.core.model;

/**
 * Item counts of a run against its plan. Items the state has never seen count as pending.
 */
public record RunSummary(
    int completed,
    int failed,
    int fatal,
    int pending,
    int total
) {
    public static RunSummary of(RunState state, ExecutionPlan plan) {
        int completed = 0;
        int failed = 0;
        int fatal = 0;
        int pending = 0;
        for (var wave : plan.waves()) {
            for (var id : wave.itemIds()) {
                switch (state.statusOf(id)) {
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case FATAL -> fatal++;
                    case PENDING, IN_PROGRESS -> pending++;
                }
            }
        }
        return new RunSummary(completed, failed, fatal, pending, completed + failed + fatal + pending);
    }

    public boolean allCompleted() {
        return total > 0 && completed == total;
    }
}
