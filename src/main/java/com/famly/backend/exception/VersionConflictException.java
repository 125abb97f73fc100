package com.famly.backend.exception;

/**
 * A compare-and-swap on a thread list kept losing to concurrent writers.
 * Raised only after the configured number of retries.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
