package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A failure observed for one work item. Appended to the run state, never mutated.
 *
 * @param itemId    the work item that failed
 * @param kind      classified error kind
 * @param message   truncated failure text
 * @param timestamp when the failure was recorded
 */
public record ErrorRecord(
    @JsonProperty("item_id") String itemId,
    @JsonProperty("kind") ErrorKind kind,
    @JsonProperty("message") String message,
    @JsonProperty("timestamp") Instant timestamp
) {}
