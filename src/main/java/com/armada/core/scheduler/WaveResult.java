package com.armada.core.scheduler;

/**
 * How a call to {@link WaveScheduler#runWave} ended.
 *
 * @param status   terminal condition of the wave
 * @param passes   number of dispatch passes made
 * @param launched total item launches across all passes
 */
public record WaveResult(Status status, int passes, int launched) {

    public enum Status {
        /** Every item is completed or fatal, or has exhausted its retries. */
        COMPLETE,
        /** A fatal item exists somewhere in the run. */
        HALTED_FATAL,
        /** Shutdown was requested before the wave could finish. */
        INTERRUPTED
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }
}
