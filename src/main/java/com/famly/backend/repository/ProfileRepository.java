package com.famly.backend.repository;

import com.famly.backend.model.ProfileRecord;

import java.util.Optional;

public interface ProfileRepository {

    // Replaces any earlier answer to the same question
    ProfileRecord save(ProfileRecord record);

    Optional<ProfileRecord> find(String userId, String questionKey);

    void delete(String userId, String questionKey);
}
