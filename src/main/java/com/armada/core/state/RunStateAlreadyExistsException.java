package com.armada.core.state;

/**
 * Thrown when initializing a run whose unfinished state already exists; the caller must resume.
 */
public class RunStateAlreadyExistsException extends RuntimeException {

    private final String runId;

    public RunStateAlreadyExistsException(String runId, String existingStatus) {
        super("State for run " + runId + " already exists (status: " + existingStatus
                + "). Resume it with --resume or discard it with --fresh.");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
