package com.armada.core.engine;

import com.armada.core.model.ExecutionPlan;
import com.armada.core.model.RunState;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Final validation or reporting step run once every wave is done, before the run is marked
 * completed. Carries no scheduling semantics.
 */
@FunctionalInterface
public interface RunFinalizer {

    RunFinalizer NONE = (state, plan) -> Optional.empty();

    Optional<Path> finalizeRun(RunState state, ExecutionPlan plan);
}
