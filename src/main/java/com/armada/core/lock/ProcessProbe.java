package com.armada.core.lock;

import java.time.Duration;

/**
 * Best-effort view of host processes. A reused PID can make a dead owner look alive.
 */
public interface ProcessProbe {

    long currentPid();

    boolean isAlive(long pid);

    /**
     * Terminates the process and its descendants and waits up to {@code timeout} for it to exit.
     *
     * @return true if the process is no longer alive afterwards
     */
    boolean terminateTree(long pid, Duration timeout);
}
