package com.armada.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by the {@code epic} and {@code project} commands.
 */
public class RunOptions {

    @Option(names = "--plan", paramLabel = "FILE",
            description = "Plan document (JSON). Defaults to the plan stored with the run.")
    Path plan;

    @Option(names = "--resume", description = "Continue the existing run")
    boolean resume;

    @Option(names = "--fresh", description = "Discard existing run state and start over")
    boolean fresh;

    @Option(names = "--force", description = "Take over a lock held by another live process")
    boolean force;

    @Option(names = "--dry-run", description = "Validate and show the plan without executing")
    boolean dryRun;

    @Option(names = {"-j", "--jobs"}, paramLabel = "N",
            description = "Maximum parallel items (0 = unbounded)")
    Integer jobs;

    @Option(names = "--max-retries", paramLabel = "N", description = "Failed attempts before giving up on an item")
    Integer maxRetries;

    @Option(names = "--timeout", paramLabel = "MIN", description = "Per-item timeout in minutes (0 = none)")
    Integer timeoutMinutes;

    /** @return a problem description, or null if the options are consistent */
    String validate() {
        if (resume && fresh) {
            return "--resume and --fresh cannot be combined";
        }
        if (jobs != null && jobs < 0) {
            return "--jobs must be >= 0";
        }
        if (maxRetries != null && maxRetries < 0) {
            return "--max-retries must be >= 0";
        }
        if (timeoutMinutes != null && timeoutMinutes < 0) {
            return "--timeout must be >= 0";
        }
        return null;
    }
}
