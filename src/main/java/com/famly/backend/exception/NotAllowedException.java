package com.famly.backend.exception;

/**
 * The caller is authenticated but may not perform this action on the target. Mapped to 403.
 */
public class NotAllowedException extends RuntimeException {

    public NotAllowedException(String message) {
        super(message);
    }

    public NotAllowedException(String message, Throwable cause) {
        super(message, cause);
    }
}
