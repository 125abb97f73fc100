package com.famly.backend.model;

import com.famly.backend.util.FamlyKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of a login session. The bearer token names it through its sid claim;
 * deleting the record ends the session.
 *
 * Key Pattern: PK = SESSION#{SessionID}, SK = METADATA
 * expiryDate is the table's TTL attribute (epoch seconds).
 */
@DynamoDbBean
public class Session extends BaseItem {

    private String sessionId;
    private String userId;
    private Long expiryDate;

    // Default constructor for DynamoDB
    public Session() {
        super();
        setItemType(FamlyKeyFactory.SESSION_PREFIX);
    }

    public Session(String userId, Instant expiresAt) {
        super();
        setItemType(FamlyKeyFactory.SESSION_PREFIX);
        this.sessionId = UUID.randomUUID().toString();
        this.userId = userId;
        this.expiryDate = expiresAt.getEpochSecond();

        setPk(FamlyKeyFactory.getSessionPk(this.sessionId));
        setSk(FamlyKeyFactory.getMetadataSk());
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Long getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(Long expiryDate) {
        this.expiryDate = expiryDate;
    }

    public boolean isExpired() {
        return expiryDate != null && Instant.now().getEpochSecond() >= expiryDate;
    }
}
