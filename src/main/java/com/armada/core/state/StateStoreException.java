package com.armada.core.state;

/**
 * Thrown when a state document cannot be read, written, or fails validation on load.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
