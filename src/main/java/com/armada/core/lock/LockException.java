package com.armada.core.lock;

/**
 * Thrown when the lock file cannot be managed at all, as opposed to being held by someone else.
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
