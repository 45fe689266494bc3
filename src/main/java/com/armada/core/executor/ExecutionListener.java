package com.armada.core.executor;

import com.armada.core.model.WorkItem;

/**
 * Callbacks from {@link BoundedExecutor}. Both run on the thread that called
 * {@link BoundedExecutor#run}, one at a time, so implementations need no synchronization.
 */
public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {};

    /** Called just before the item is launched. */
    default void onStarted(WorkItem item) {}

    /** Called as soon as the item finishes, in completion order. */
    default void onFinished(WorkOutcome outcome) {}
}
