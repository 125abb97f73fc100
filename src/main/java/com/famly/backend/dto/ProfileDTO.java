package com.famly.backend.dto;

import com.famly.backend.model.ProfileRecord;

import java.util.List;

public class ProfileDTO {

    private String question;
    private List<String> selectedChoices;

    public ProfileDTO(ProfileRecord record) {
        this.question = record.getQuestion();
        this.selectedChoices = List.copyOf(record.getSelectedChoices());
    }

    public String getQuestion() {
        return question;
    }

    public List<String> getSelectedChoices() {
        return selectedChoices;
    }
}
