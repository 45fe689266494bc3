package com.armada.core.model;

import java.util.List;

/**
 * One schedulable unit: an issue number at epic level, an epic number at project level.
 *
 * @param id        identifier, unique within one execution plan
 * @param title     human title supplied by the plan author
 * @param dependsOn identifiers this item depends on; informational only, wave placement
 *                  already encodes the resolved order
 */
public record WorkItem(
    String id,
    String title,
    List<String> dependsOn
) {
    public WorkItem {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static WorkItem of(String id) {
        return new WorkItem(id, id, List.of());
    }
}
