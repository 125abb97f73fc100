package com.famly.backend.exception;

public class ProfileNotFoundException extends ResourceNotFoundException {

    public ProfileNotFoundException(String userId, String question) {
        super("Profile entry for user " + userId + " and question \"" + question + "\" not found!");
    }
}
