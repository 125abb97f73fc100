package com.famly.backend.dto;

import com.famly.backend.model.User;

import java.time.Instant;

/**
 * Public view of an account. Never carries the password hash.
 */
public class UserDTO {

    private String id;
    private String username;
    private Instant creationDate;

    public UserDTO(User user) {
        this.id = user.getId() != null ? user.getId().toString() : null;
        this.username = user.getUsername();
        this.creationDate = user.getCreationDate();
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public Instant getCreationDate() {
        return creationDate;
    }
}
