package com.famly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The onboarding question and the choices a user may pick from.
 * Both the route-level validation and the stored records read it from here.
 */
@Component
@ConfigurationProperties(prefix = "famly.profiling")
public class ProfilingProperties {

    private String questionKey = "goals";

    private String question = "What are your goals in Fam.ly?";

    private List<String> options = new ArrayList<>(List.of(
        "Learn family history",
        "Connect more often",
        "Learn others' interests",
        "Learn about identity"
    ));

    public String getQuestionKey() {
        return questionKey;
    }

    public void setQuestionKey(String questionKey) {
        this.questionKey = questionKey;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public List<String> getOptions() {
        return options;
    }

    public void setOptions(List<String> options) {
        this.options = options;
    }

    public boolean isValidChoice(String choice) {
        return options.contains(choice);
    }
}
