package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted progress of one work item.
 *
 * @param status    current status
 * @param attempts  number of in_progress -&gt; failed transitions so far; never decreases
 * @param message   last outcome message, may be empty
 * @param updatedAt last transition time
 */
public record ItemState(
    @JsonProperty("status") ItemStatus status,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("message") String message,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public static final ItemState PENDING = new ItemState(ItemStatus.PENDING, 0, "", null);

    public ItemState {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0 (got " + attempts + ")");
        }
        message = message == null ? "" : message;
    }

    public ItemState dispatched(Instant now) {
        return transition(ItemStatus.IN_PROGRESS, attempts, "", now);
    }

    public ItemState completed(String msg, Instant now) {
        return transition(ItemStatus.COMPLETED, attempts, msg, now);
    }

    /** Failed transitions are the only ones that advance the attempt counter. */
    public ItemState failed(String msg, Instant now) {
        return transition(ItemStatus.FAILED, attempts + 1, msg, now);
    }

    public ItemState fatal(String msg, Instant now) {
        return transition(ItemStatus.FATAL, attempts, msg, now);
    }

    private ItemState transition(ItemStatus next, int nextAttempts, String msg, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Invalid item transition: %s -> %s", status.wireName(), next.wireName()));
        }
        return new ItemState(next, nextAttempts, msg, now);
    }
}
