package com.famly.backend.service;

import com.famly.backend.model.ProfileRecord;

import java.util.List;

/**
 * Answers to the configured onboarding question, one record per user.
 */
public interface ProfilingService {

    /**
     * Validate the choices without storing anything.
     *
     * @throws com.famly.backend.exception.InvalidProfileChoiceException listing the unknown choices
     */
    void validateChoices(List<String> choices);

    /**
     * Record the user's choices. Null or empty choices leave the profile untouched.
     */
    String ask(String userId, List<String> choices);

    String updateProfile(String userId, List<String> choices);

    ProfileRecord getUserResponses(String userId);

    void deleteProfile(String userId);

    String getQuestion();

    List<String> getOptions();
}
