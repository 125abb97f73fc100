package com.famly.backend.exception;

public class ThreadNotFoundException extends ResourceNotFoundException {

    public ThreadNotFoundException(String threadId) {
        super("Thread " + threadId + " does not exist!");
    }
}
