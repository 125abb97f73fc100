package com.famly.backend.exception;

/**
 * The acting user did not create the thread they are trying to change.
 */
public class ThreadCreatorMismatchException extends NotAllowedException {

    private final String userId;
    private final String threadId;

    public ThreadCreatorMismatchException(String userId, String threadId) {
        super(userId + " is not the creator of thread " + threadId + "!");
        this.userId = userId;
        this.threadId = threadId;
    }

    public String getUserId() {
        return userId;
    }

    public String getThreadId() {
        return threadId;
    }
}
