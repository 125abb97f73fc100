package com.famly.backend.exception;

/**
 * The second step of a thread/post orchestration failed after the first succeeded.
 * Compensation has already been attempted when this is thrown.
 */
public class ThreadSyncException extends RuntimeException {

    public ThreadSyncException(String message) {
        super(message);
    }

    public ThreadSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
