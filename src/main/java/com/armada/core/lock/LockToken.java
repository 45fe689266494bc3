package com.armada.core.lock;

import java.nio.file.Path;

/**
 * Proof of lock ownership, handed back to {@link LockManager#release(LockToken)}.
 */
public record LockToken(String runId, long pid, Path file) {}
