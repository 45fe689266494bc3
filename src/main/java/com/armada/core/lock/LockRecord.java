package com.armada.core.lock;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * On-disk content of a run's lock file.
 */
public record LockRecord(
    @JsonProperty("run_id") String runId,
    @JsonProperty("pid") long pid,
    @JsonProperty("acquired_at") Instant acquiredAt
) {}
