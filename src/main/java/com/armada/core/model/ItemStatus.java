package com.armada.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a single work item within one run.
 *
 * <pre>
 * pending     -> in_progress
 * in_progress -> completed | failed | fatal | in_progress (re-dispatch after a crash)
 * failed      -> in_progress (retry)
 * completed, fatal: terminal
 * </pre>
 */
public enum ItemStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    FATAL("fatal");

    private final String wireName;

    ItemStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ItemStatus fromWireName(String value) {
        for (ItemStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown item status: " + value);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FATAL;
    }

    public boolean canTransitionTo(ItemStatus next) {
        return switch (this) {
            case PENDING, FAILED -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED || next == FATAL || next == IN_PROGRESS;
            case COMPLETED, FATAL -> false;
        };
    }
}
