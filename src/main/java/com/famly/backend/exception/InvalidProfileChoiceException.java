package com.famly.backend.exception;

import java.util.List;

public class InvalidProfileChoiceException extends ValidationException {

    private final List<String> invalidChoices;

    public InvalidProfileChoiceException(List<String> invalidChoices) {
        super("Invalid choices: " + String.join(", ", invalidChoices));
        this.invalidChoices = List.copyOf(invalidChoices);
    }

    public List<String> getInvalidChoices() {
        return invalidChoices;
    }
}
