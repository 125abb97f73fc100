package com.famly.backend.exception;

/**
 * Request data failed a business rule (empty title, blank content, ...). Mapped to 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
