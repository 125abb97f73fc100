package com.famly.backend.repository.impl;

import com.famly.backend.exception.PostNotFoundException;
import com.famly.backend.exception.RepositoryException;
import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;
import com.famly.backend.repository.PostRepository;
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
import java.util.*;
import java.util.stream.Collectors;

@Repository
public class PostRepositoryImpl implements PostRepository {

    private static final Logger logger = LoggerFactory.getLogger(PostRepositoryImpl.class);
    private static final String TABLE_NAME = "FamlyTable";
    private static final String USER_INDEX = "UserIndex";
    private static final int BATCH_GET_LIMIT = 100;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final TableSchema<Post> postSchema;
    private final TableSchema<PostOptions> optionsSchema;

    @Autowired
    public PostRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.postSchema = TableSchema.fromBean(Post.class);
        this.optionsSchema = TableSchema.fromBean(PostOptions.class);
    }

    @Override
    public Post create(Post post) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(postSchema.itemToMap(post, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                logger.info("Created post {} in thread {}", post.getPostId(), post.getThread());
                return post;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Post " + post.getPostId() + " already exists", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to create post {}", post.getPostId(), e);
                throw new RepositoryException("Failed to create post", e);
            }
        });
    }

    @Override
    public Optional<Post> findById(String postId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(postKey(postId))
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(postSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find post {}", postId, e);
                throw new RepositoryException("Failed to retrieve post", e);
            }
        });
    }

    @Override
    public void update(String postId, String content, PostOptions options) {
        List<String> assignments = new ArrayList<>();
        Map<String, AttributeValue> values = new HashMap<>();

        if (content != null) {
            assignments.add("content = :content");
            values.put(":content", AttributeValue.builder().s(content).build());
        }
        if (options != null) {
            assignments.add("#options = :options");
            values.put(":options", AttributeValue.builder().m(optionsSchema.itemToMap(options, true)).build());
        }
        assignments.add("updatedAt = :now");
        values.put(":now", AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build());

        UpdateItemRequest.Builder builder = UpdateItemRequest.builder()
            .tableName(TABLE_NAME)
            .key(postKey(postId))
            .updateExpression("SET " + String.join(", ", assignments))
            .conditionExpression("attribute_exists(pk)")
            .expressionAttributeValues(values);
        if (options != null) {
            builder.expressionAttributeNames(Map.of("#options", "options"));
        }
        UpdateItemRequest request = builder.build();

        queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(request);
                return null;
            } catch (ConditionalCheckFailedException e) {
                throw new PostNotFoundException(postId);
            } catch (DynamoDbException e) {
                logger.error("Failed to update post {}", postId, e);
                throw new RepositoryException("Failed to update post", e);
            }
        });
    }

    @Override
    public void delete(String postId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                DeleteItemRequest request = DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(postKey(postId))
                    .conditionExpression("attribute_exists(pk)")
                    .build();

                dynamoDbClient.deleteItem(request);
                logger.info("Deleted post {}", postId);
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new PostNotFoundException(postId);
            } catch (DynamoDbException e) {
                logger.error("Failed to delete post {}", postId, e);
                throw new RepositoryException("Failed to delete post", e);
            }
        });
    }

    @Override
    public List<Post> findByAuthor(String userId) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                List<Post> posts = new ArrayList<>();
                Map<String, AttributeValue> lastKey = null;

                do {
                    QueryRequest.Builder builder = QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .indexName(USER_INDEX)
                        .keyConditionExpression("gsi1pk = :gsi1pk AND begins_with(gsi1sk, :prefix)")
                        .expressionAttributeValues(Map.of(
                            ":gsi1pk", AttributeValue.builder().s(FamlyKeyFactory.getAuthorGsi1Pk(userId)).build(),
                            ":prefix", AttributeValue.builder().s(FamlyKeyFactory.POST_PREFIX).build()
                        ))
                        .scanIndexForward(false);
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    QueryResponse response = dynamoDbClient.query(builder.build());
                    response.items().forEach(item -> posts.add(postSchema.mapToItem(item)));
                    lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (lastKey != null);

                return posts;

            } catch (DynamoDbException e) {
                logger.error("Failed to query posts by author {}", userId, e);
                throw new RepositoryException("Failed to retrieve posts by author", e);
            }
        });
    }

    @Override
    public List<Post> findAll() {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                List<Post> posts = new ArrayList<>();
                Map<String, AttributeValue> lastKey = null;

                do {
                    ScanRequest.Builder builder = ScanRequest.builder()
                        .tableName(TABLE_NAME)
                        .filterExpression("itemType = :itemType")
                        .expressionAttributeValues(Map.of(
                            ":itemType", AttributeValue.builder().s(FamlyKeyFactory.POST_PREFIX).build()
                        ));
                    if (lastKey != null) {
                        builder.exclusiveStartKey(lastKey);
                    }

                    ScanResponse response = dynamoDbClient.scan(builder.build());
                    response.items().forEach(item -> posts.add(postSchema.mapToItem(item)));
                    lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (lastKey != null);

                posts.sort(Comparator.comparing(Post::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())));
                return posts;

            } catch (DynamoDbException e) {
                logger.error("Failed to scan posts", e);
                throw new RepositoryException("Failed to retrieve posts", e);
            }
        });
    }

    @Override
    public List<Post> findAllByIds(List<String> postIds) {
        if (postIds == null || postIds.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> distinctIds = new ArrayList<>(new LinkedHashSet<>(postIds));

        Map<String, Post> found = queryTracker.trackQuery("BatchGetItem", TABLE_NAME, () -> {
            try {
                Map<String, Post> byId = new HashMap<>();

                for (int i = 0; i < distinctIds.size(); i += BATCH_GET_LIMIT) {
                    List<Map<String, AttributeValue>> keys = distinctIds
                        .subList(i, Math.min(i + BATCH_GET_LIMIT, distinctIds.size()))
                        .stream()
                        .map(this::postKey)
                        .collect(Collectors.toList());

                    Map<String, KeysAndAttributes> pending = Map.of(TABLE_NAME,
                        KeysAndAttributes.builder().keys(keys).build());

                    // Unprocessed keys come back under load and are re-requested
                    while (pending != null && !pending.isEmpty()) {
                        BatchGetItemResponse response = dynamoDbClient.batchGetItem(
                            BatchGetItemRequest.builder().requestItems(pending).build());

                        response.responses().getOrDefault(TABLE_NAME, List.of()).forEach(item -> {
                            Post post = postSchema.mapToItem(item);
                            byId.put(post.getPostId(), post);
                        });
                        pending = response.hasUnprocessedKeys() ? response.unprocessedKeys() : null;
                    }
                }
                return byId;

            } catch (DynamoDbException e) {
                logger.error("Failed to batch get {} posts", distinctIds.size(), e);
                throw new RepositoryException("Failed to retrieve posts", e);
            }
        });

        return postIds.stream()
            .map(found::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    private Map<String, AttributeValue> postKey(String postId) {
        return Map.of(
            "pk", AttributeValue.builder().s(FamlyKeyFactory.getPostPk(postId)).build(),
            "sk", AttributeValue.builder().s(FamlyKeyFactory.getMetadataSk()).build()
        );
    }
}
