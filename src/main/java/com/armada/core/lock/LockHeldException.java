package com.armada.core.lock;

/**
 * Thrown when another live process owns the run's lock and {@code force} was not requested.
 */
public class LockHeldException extends RuntimeException {

    private final String runId;
    private final long ownerPid;

    public LockHeldException(String runId, long ownerPid) {
        super("Run " + runId + " is already being orchestrated by PID " + ownerPid
                + ". Use --force to take over.");
        this.runId = runId;
        this.ownerPid = ownerPid;
    }

    public String getRunId() {
        return runId;
    }

    public long getOwnerPid() {
        return ownerPid;
    }
}
