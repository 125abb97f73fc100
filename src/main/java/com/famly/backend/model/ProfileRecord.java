package com.famly.backend.model;

import com.famly.backend.util.FamlyKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.ArrayList;
import java.util.List;

/**
 * A user's answer to a profiling question.
 *
 * Key Pattern: PK = USER#{UserID}, SK = PROFILE#{questionKey}
 * One record per (user, question); writes replace the previous answer.
 */
@DynamoDbBean
public class ProfileRecord extends BaseItem {

    private String userId;
    private String question;
    private List<String> selectedChoices = new ArrayList<>();

    // Default constructor for DynamoDB
    public ProfileRecord() {
        super();
        setItemType(FamlyKeyFactory.PROFILE_PREFIX);
    }

    public ProfileRecord(String userId, String questionKey, String question, List<String> selectedChoices) {
        super();
        setItemType(FamlyKeyFactory.PROFILE_PREFIX);
        this.userId = userId;
        this.question = question;
        this.selectedChoices = new ArrayList<>(selectedChoices);

        setPk(FamlyKeyFactory.getUserPk(userId));
        setSk(FamlyKeyFactory.getProfileSk(questionKey));
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public List<String> getSelectedChoices() {
        return selectedChoices;
    }

    public void setSelectedChoices(List<String> selectedChoices) {
        this.selectedChoices = selectedChoices != null ? new ArrayList<>(selectedChoices) : new ArrayList<>();
    }
}
