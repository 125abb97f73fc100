package com.famly.backend.repository.impl;

import com.famly.backend.config.ThreadingProperties;
import com.famly.backend.exception.RepositoryException;
import com.famly.backend.exception.ThreadNotFoundException;
import com.famly.backend.exception.VersionConflictException;
import com.famly.backend.model.DiscussionThread;
import com.famly.backend.repository.ThreadRepository;
import com.famly.backend.util.FamlyKeyFactory;
import com.famly.backend.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thread storage on the low-level client. Appends and removals on the content and member lists
 * are conditional single-item updates rather than read-modify-write of the whole item.
 */
@Repository
public class ThreadRepositoryImpl implements ThreadRepository {

    private static final Logger logger = LoggerFactory.getLogger(ThreadRepositoryImpl.class);
    private static final String TABLE_NAME = "FamlyTable";

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final ThreadingProperties threadingProperties;
    private final TableSchema<DiscussionThread> threadSchema;

    @Autowired
    public ThreadRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker,
                                ThreadingProperties threadingProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.threadingProperties = threadingProperties;
        this.threadSchema = TableSchema.fromBean(DiscussionThread.class);
    }

    @Override
    public DiscussionThread create(DiscussionThread thread) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(threadSchema.itemToMap(thread, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                logger.info("Created thread {} by {}", thread.getThreadId(), thread.getCreator());
                return thread;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Thread " + thread.getThreadId() + " already exists", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to create thread {}", thread.getThreadId(), e);
                throw new RepositoryException("Failed to create thread", e);
            }
        });
    }

    @Override
    public Optional<DiscussionThread> findById(String threadId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(threadKey(threadId))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(threadSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find thread {}", threadId, e);
                throw new RepositoryException("Failed to retrieve thread", e);
            }
        });
    }

    @Override
    public void updateTitle(String threadId, String title) {
        queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(threadKey(threadId))
                    .updateExpression("SET title = :title, updatedAt = :now")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeValues(Map.of(
                        ":title", AttributeValue.builder().s(title).build(),
                        ":now", now()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new ThreadNotFoundException(threadId);
            } catch (DynamoDbException e) {
                logger.error("Failed to update title of thread {}", threadId, e);
                throw new RepositoryException("Failed to update thread title", e);
            }
        });
    }

    @Override
    public void delete(String threadId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(threadKey(threadId))
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.info("Deleted thread {}", threadId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to delete thread {}", threadId, e);
                throw new RepositoryException("Failed to delete thread", e);
            }
        });
    }

    @Override
    public boolean appendToList(String threadId, ListAttribute list, String value) {
        boolean appended = queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(threadKey(threadId))
                    .updateExpression("SET #list = list_append(if_not_exists(#list, :empty), :value), updatedAt = :now")
                    .conditionExpression("attribute_exists(pk) AND NOT contains(#list, :id)")
                    .expressionAttributeNames(Map.of("#list", list.getAttributeName()))
                    .expressionAttributeValues(Map.of(
                        ":empty", AttributeValue.builder().l(List.of()).build(),
                        ":value", AttributeValue.builder().l(AttributeValue.builder().s(value).build()).build(),
                        ":id", AttributeValue.builder().s(value).build(),
                        ":now", now()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                return true;

            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to append {} to {} of thread {}", value, list.getAttributeName(), threadId, e);
                throw new RepositoryException("Failed to update thread", e);
            }
        });

        if (!appended) {
            // Either the thread is gone or the value is already there
            if (findById(threadId).isEmpty()) {
                throw new ThreadNotFoundException(threadId);
            }
            logger.debug("{} already in {} of thread {}", value, list.getAttributeName(), threadId);
        }
        return appended;
    }

    @Override
    public boolean removeFromList(String threadId, ListAttribute list, String value) {
        int maxAttempts = Math.max(1, threadingProperties.getMaxUpdateRetries());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            DiscussionThread thread = findById(threadId)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));

            List<String> current = list == ListAttribute.CONTENT ? thread.getContent() : thread.getMembers();
            int index = current.indexOf(value);
            if (index < 0) {
                return false;
            }

            if (tryRemoveAt(threadId, list, index, value)) {
                return true;
            }
            logger.debug("List {} of thread {} changed under removal of {}, attempt {}/{}",
                list.getAttributeName(), threadId, value, attempt, maxAttempts);
        }

        logger.warn("Gave up removing {} from {} of thread {} after {} attempts",
            value, list.getAttributeName(), threadId, maxAttempts);
        throw new VersionConflictException("Thread " + threadId + " is being modified concurrently, try again");
    }

    /**
     * Remove the slot at index only if it still holds the value that was read.
     */
    private boolean tryRemoveAt(String threadId, ListAttribute list, int index, String value) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(threadKey(threadId))
                    .updateExpression("SET updatedAt = :now REMOVE #list[" + index + "]")
                    .conditionExpression("#list[" + index + "] = :id")
                    .expressionAttributeNames(Map.of("#list", list.getAttributeName()))
                    .expressionAttributeValues(Map.of(
                        ":id", AttributeValue.builder().s(value).build(),
                        ":now", now()
                    ))
                    .build();

                dynamoDbClient.updateItem(request);
                return true;

            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to remove {} from {} of thread {}", value, list.getAttributeName(), threadId, e);
                throw new RepositoryException("Failed to update thread", e);
            }
        });
    }

    private Map<String, AttributeValue> threadKey(String threadId) {
        return Map.of(
            "pk", AttributeValue.builder().s(FamlyKeyFactory.getThreadPk(threadId)).build(),
            "sk", AttributeValue.builder().s(FamlyKeyFactory.getMetadataSk()).build()
        );
    }

    private AttributeValue now() {
        return AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build();
    }
}
