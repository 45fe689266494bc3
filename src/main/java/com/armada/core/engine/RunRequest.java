package com.armada.core.engine;

import com.armada.core.model.RunLevel;
import com.armada.core.scheduler.SchedulerSettings;

import java.nio.file.Path;

/**
 * One invocation of the driver.
 *
 * @param level    scheduling granularity
 * @param target   epic number or project name; the run id is derived from it
 * @param planFile plan document to use, or null to reuse the plan stored for the run
 * @param resume   continue an existing run instead of requiring a new one
 * @param fresh    discard any existing state first
 * @param force    take over a lock held by a live process
 * @param dryRun   validate and describe only; no lock, no writes
 * @param settings scheduling limits
 */
public record RunRequest(
    RunLevel level,
    String target,
    Path planFile,
    boolean resume,
    boolean fresh,
    boolean force,
    boolean dryRun,
    SchedulerSettings settings
) {
    public RunRequest {
        if (level == null) {
            throw new IllegalArgumentException("level is required");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        if (resume && fresh) {
            throw new IllegalArgumentException("--resume and --fresh are mutually exclusive");
        }
    }

    public String runId() {
        return level.runId(target);
    }
}
