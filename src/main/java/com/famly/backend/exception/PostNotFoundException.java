package com.famly.backend.exception;

public class PostNotFoundException extends ResourceNotFoundException {

    public PostNotFoundException(String postId) {
        super("Post " + postId + " does not exist!");
    }
}
