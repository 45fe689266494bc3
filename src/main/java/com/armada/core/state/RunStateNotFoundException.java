package com.armada.core.state;

/**
 * Thrown when loading a run that has no persisted state.
 */
public class RunStateNotFoundException extends RuntimeException {

    private final String runId;

    public RunStateNotFoundException(String runId) {
        super("No state found for run " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
