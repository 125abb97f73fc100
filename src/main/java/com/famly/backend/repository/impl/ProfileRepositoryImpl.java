package com.famly.backend.repository.impl;

import com.famly.backend.exception.RepositoryException;
import com.famly.backend.model.ProfileRecord;
import com.famly.backend.repository.ProfileRepository;
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
public class ProfileRepositoryImpl implements ProfileRepository {

    private static final Logger logger = LoggerFactory.getLogger(ProfileRepositoryImpl.class);
    private static final String TABLE_NAME = "FamlyTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final TableSchema<ProfileRecord> profileSchema;

    @Autowired
    public ProfileRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.profileSchema = TableSchema.fromBean(ProfileRecord.class);
    }

    @Override
    public ProfileRecord save(ProfileRecord record) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                record.touch();
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(profileSchema.itemToMap(record, true))
                    .build());
                return record;

            } catch (DynamoDbException e) {
                logger.error("Failed to save profile record for user {}", record.getUserId(), e);
                throw new RepositoryException("Failed to save profile", e);
            }
        });
    }

    @Override
    public Optional<ProfileRecord> find(String userId, String questionKey) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(profileKey(userId, questionKey))
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(profileSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find profile record for user {}", userId, e);
                throw new RepositoryException("Failed to retrieve profile", e);
            }
        });
    }

    @Override
    public void delete(String userId, String questionKey) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(profileKey(userId, questionKey))
                    .build());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete profile record for user {}", userId, e);
                throw new RepositoryException("Failed to delete profile", e);
            }
        });
    }

    private Map<String, AttributeValue> profileKey(String userId, String questionKey) {
        return Map.of(
            "pk", AttributeValue.builder().s(FamlyKeyFactory.getUserPk(userId)).build(),
            "sk", AttributeValue.builder().s(FamlyKeyFactory.getProfileSk(questionKey)).build()
        );
    }
}
