package com.armada.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An accepted, validated plan: ordered waves plus optional metadata. Immutable.
 *
 * @param waves           waves in execution order
 * @param items           work items keyed by identifier
 * @param successCriteria optional success criteria, echoed in the final report
 * @param estimatedTime   optional free-text time estimate
 */
public record ExecutionPlan(
    List<Wave> waves,
    Map<String, WorkItem> items,
    List<String> successCriteria,
    String estimatedTime
) {
    public ExecutionPlan {
        waves = waves == null ? List.of() : List.copyOf(waves);
        items = items == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(items));
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
    }

    public WorkItem item(String id) {
        WorkItem item = items.get(id);
        return item != null ? item : WorkItem.of(id);
    }

    public List<WorkItem> itemsOf(Wave wave) {
        return wave.itemIds().stream().map(this::item).toList();
    }

    public int totalItems() {
        return waves.stream().mapToInt(w -> w.itemIds().size()).sum();
    }
}
