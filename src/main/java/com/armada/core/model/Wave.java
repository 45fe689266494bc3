package com.armada.core.model;

import java.util.List;

/**
 * A batch of work items that may run concurrently.
 *
 * @param number      stage number, 1-based and strictly increasing within a plan
 * @param itemIds     identifiers of the items in this wave
 * @param description optional free text from the plan author
 */
public record Wave(
    int number,
    List<String> itemIds,
    String description
) {
    public Wave {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }
}
