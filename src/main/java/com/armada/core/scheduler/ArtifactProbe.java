package com.armada.core.scheduler;

import com.armada.core.model.RunLevel;
import com.armada.core.model.WorkItem;

import java.util.Optional;

/**
 * Looks for the artifact a successful unit of work leaves behind, such as a pull-request URL.
 * An item with an artifact counts as completed even if its exit status said otherwise.
 */
@FunctionalInterface
public interface ArtifactProbe {

    ArtifactProbe NONE = (level, item) -> Optional.empty();

    Optional<String> find(RunLevel level, WorkItem item);
}
