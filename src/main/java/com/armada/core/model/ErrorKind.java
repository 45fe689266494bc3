package com.armada.core.model;

/**
 * Classified failure kinds observed in the output of a unit of work.
 *
 * <p>{@link #AUTH} and {@link #QUOTA} are fatal and halt the whole run.
 * {@link #NONE} marks a failure no pattern recognised; it is retried under the
 * generic policy.
 */
public enum ErrorKind {
    NONE("NONE"),
    RATE_LIMIT("RATE_LIMIT"),
    AUTH("AUTH_ERROR"),
    QUOTA("QUOTA_EXCEEDED"),
    TIMEOUT("TIMEOUT"),
    NETWORK("NETWORK_ERROR"),
    API_ERROR("API_ERROR");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    /** Human-readable label used in reports. */
    public String label() {
        return label;
    }

    public boolean isFatal() {
        return this == AUTH || this == QUOTA;
    }

    public boolean isRetryable() {
        return this == RATE_LIMIT || this == TIMEOUT || this == NETWORK || this == API_ERROR;
    }
}
