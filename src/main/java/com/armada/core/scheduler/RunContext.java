package com.armada.core.scheduler;

import com.armada.core.executor.UnitOfWork;
import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.RunLevel;

import java.util.function.BooleanSupplier;

/**
 * Everything the scheduler needs to know about the run a wave belongs to.
 */
public record RunContext(
    String runId,
    RunLevel level,
    ExecutionPlan plan,
    UnitOfWork work,
    SchedulerSettings settings,
    BooleanSupplier stopRequested,
    Sleeper sleeper
) {}
