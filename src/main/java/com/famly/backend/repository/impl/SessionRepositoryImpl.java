package com.famly.backend.repository.impl;

import com.famly.backend.exception.RepositoryException;
import com.famly.backend.model.Session;
import com.famly.backend.repository.SessionRepository;
import com.famly.backend.util.FamlyKeyFactory;
import com.famly.backend.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.Optional;

@Repository
public class SessionRepositoryImpl implements SessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(SessionRepositoryImpl.class);
    private static final String TABLE_NAME = "FamlyTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final TableSchema<Session> sessionSchema;

    @Autowired
    public SessionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.sessionSchema = TableSchema.fromBean(Session.class);
    }

    @Override
    public Session save(Session session) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(sessionSchema.itemToMap(session, true))
                    .build());
                return session;

            } catch (DynamoDbException e) {
                logger.error("Failed to save session for user {}", session.getUserId(), e);
                throw new RepositoryException("Failed to save session", e);
            }
        });
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        if (!FamlyKeyFactory.isValidId(sessionId)) {
            return Optional.empty();
        }
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(sessionKey(sessionId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(sessionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find session {}", sessionId, e);
                throw new RepositoryException("Failed to retrieve session", e);
            }
        });
    }

    @Override
    public void delete(String sessionId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(sessionKey(sessionId))
                    .build());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete session {}", sessionId, e);
                throw new RepositoryException("Failed to delete session", e);
            }
        });
    }

    private Map<String, AttributeValue> sessionKey(String sessionId) {
        return Map.of(
            "pk", AttributeValue.builder().s(FamlyKeyFactory.getSessionPk(sessionId)).build(),
            "sk", AttributeValue.builder().s(FamlyKeyFactory.getMetadataSk()).build()
        );
    }
}
