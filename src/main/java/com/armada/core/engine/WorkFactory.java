package com.armada.core.engine;

import com.armada.core.executor.UnitOfWork;

/**
 * Supplies the unit of work for a run. Receives the driver so that project-level work can
 * start nested runs through it.
 */
@FunctionalInterface
public interface WorkFactory {

    UnitOfWork create(RunRequest request, RunDriver driver);
}
