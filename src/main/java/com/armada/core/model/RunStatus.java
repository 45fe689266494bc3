package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall lifecycle status of an orchestration run.
 */
public enum RunStatus {
    INITIALIZED("initialized"),
    RUNNING("running"),
    INTERRUPTED("interrupted"),
    FATAL_ERROR("fatal_error"),
    COMPLETED("completed");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static RunStatus fromWireName(String value) {
        for (RunStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
