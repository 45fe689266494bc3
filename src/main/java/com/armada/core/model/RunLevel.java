package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Granularity a run schedules at: issues within an epic, or epics within a project.
 */
public enum RunLevel {
    EPIC("epic", "issue"),
    PROJECT("project", "epic");

    private final String prefix;
    private final String itemNoun;

    RunLevel(String prefix, String itemNoun) {
        this.prefix = prefix;
        this.itemNoun = itemNoun;
    }

    /** Run identifier for a target of this level, e.g. {@code epic-151}. */
    public String runId(String target) {
        return prefix + "-" + target;
    }

    /** What a single work item is called at this level ("issue" or "epic"). */
    public String itemNoun() {
        return itemNoun;
    }

    @JsonValue
    public String prefix() {
        return prefix;
    }

    @JsonCreator
    public static RunLevel fromPrefix(String value) {
        for (RunLevel level : values()) {
            if (level.prefix.equalsIgnoreCase(value) || level.name().equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown run level: " + value);
    }
}
