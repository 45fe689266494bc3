package com.armada.core.executor;

import com.armada.core.model.WorkItem;

/**
 * Performs the actual work for one item: an agent process at epic level, a nested run at
 * project level. Re-invocation on a failed item must be safe.
 *
 * <p>Implementations should respond to thread interruption by stopping promptly; the
 * executor interrupts a unit of work whose per-item timeout elapsed.
 */
@FunctionalInterface
public interface UnitOfWork {

    WorkResult execute(WorkItem item) throws Exception;
}
