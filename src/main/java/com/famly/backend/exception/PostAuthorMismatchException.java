package com.famly.backend.exception;

/**
 * The acting user did not write the post they are trying to change.
 */
public class PostAuthorMismatchException extends NotAllowedException {

    private final String userId;
    private final String postId;

    public PostAuthorMismatchException(String userId, String postId) {
        super(userId + " is not the author of post " + postId + "!");
        this.userId = userId;
        this.postId = postId;
    }

    public String getUserId() {
        return userId;
    }

    public String getPostId() {
        return postId;
    }
}
