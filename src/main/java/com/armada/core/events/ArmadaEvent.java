package com.armada.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during run execution, rendered by the CLI as progress output.
 *
 * @param eventType event type (e.g. "run.started", "wave.started", "item.failed")
 * @param runId     the run this event belongs to
 * @param itemId    the work item this event relates to (nullable for run- and wave-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ArmadaEvent(
    String eventType,
    String runId,
    String itemId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ArmadaEvent of(String eventType, String runId, String itemId, Map<String, Object> payload) {
        return new ArmadaEvent(eventType, runId, itemId, payload == null ? Map.of() : payload, Instant.now());
    }
}
