package com.famly.backend.service.impl;

import com.famly.backend.config.ProfilingProperties;
import com.famly.backend.exception.InvalidProfileChoiceException;
import com.famly.backend.exception.ProfileNotFoundException;
import com.famly.backend.model.ProfileRecord;
import com.famly.backend.repository.ProfileRepository;
import com.famly.backend.service.ProfilingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class ProfilingServiceImpl implements ProfilingService {

    private static final Logger logger = LoggerFactory.getLogger(ProfilingServiceImpl.class);

    private final ProfileRepository profileRepository;
    private final ProfilingProperties profilingProperties;

    @Autowired
    public ProfilingServiceImpl(ProfileRepository profileRepository, ProfilingProperties profilingProperties) {
        this.profileRepository = profileRepository;
        this.profilingProperties = profilingProperties;
    }

    @Override
    public void validateChoices(List<String> choices) {
        if (choices == null) {
            return;
        }
        List<String> invalid = choices.stream()
            .filter(choice -> !profilingProperties.isValidChoice(choice))
            .collect(Collectors.toList());
        if (!invalid.isEmpty()) {
            throw new InvalidProfileChoiceException(invalid);
        }
    }

    @Override
    public String ask(String userId, List<String> choices) {
        if (choices == null || choices.isEmpty()) {
            return "No profile choices given";
        }
        validateChoices(choices);

        profileRepository.save(new ProfileRecord(userId, profilingProperties.getQuestionKey(),
            profilingProperties.getQuestion(), choices));
        logger.info("Recorded {} profile choices for user {}", choices.size(), userId);
        return "Profile updated successfully!";
    }

    @Override
    public String updateProfile(String userId, List<String> choices) {
        return ask(userId, choices);
    }

    @Override
    public ProfileRecord getUserResponses(String userId) {
        return profileRepository.find(userId, profilingProperties.getQuestionKey())
            .orElseThrow(() -> new ProfileNotFoundException(userId, profilingProperties.getQuestion()));
    }

    @Override
    public void deleteProfile(String userId) {
        profileRepository.delete(userId, profilingProperties.getQuestionKey());
    }

    @Override
    public String getQuestion() {
        return profilingProperties.getQuestion();
    }

    @Override
    public List<String> getOptions() {
        return profilingProperties.getOptions();
    }
}
