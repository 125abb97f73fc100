package com.famly.backend.config;

import com.famly.backend.model.BaseItem;
import com.famly.backend.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;

/**
 * Creates the Users table and the single FamlyTable on startup when they are missing.
 * Disabled with famly.dynamodb.init-tables=false.
 */
@Component
@ConditionalOnProperty(prefix = "famly.dynamodb", name = "init-tables", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    public static final String USERS_TABLE = "Users";
    public static final String FAMLY_TABLE = "FamlyTable";

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    private DynamoDbClient dynamoDbClient;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createTableIfNotExists(USERS_TABLE, User.class);

        // Threads, posts, profile records and sessions share one table
        boolean created = createTableIfNotExists(FAMLY_TABLE, BaseItem.class);
        if (created) {
            configureTTL(FAMLY_TABLE, "expiryDate");
        }
    }

    private <T> boolean createTableIfNotExists(String tableName, Class<T> entityClass) {
        try {
            DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
            table.describeTable();
            logger.info("Table {} already exists", tableName);
            return false;

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            createTableWithGSIs(tableName, entityClass);
            logger.info("Table {} created successfully with GSIs", tableName);
            return true;
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    private <T> void createTableWithGSIs(String tableName, Class<T> entityClass) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));

        CreateTableEnhancedRequest.Builder requestBuilder = CreateTableEnhancedRequest.builder()
            .provisionedThroughput(ProvisionedThroughput.builder()
                .readCapacityUnits(5L)
                .writeCapacityUnits(5L)
                .build());

        switch (tableName) {
            case USERS_TABLE:
                requestBuilder.globalSecondaryIndices(createGSI("UsernameIndex"));
                break;
            case FAMLY_TABLE:
                requestBuilder.globalSecondaryIndices(createGSI("UserIndex"));
                break;
            default:
                break;
        }

        table.createTable(requestBuilder.build());
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(ProvisionedThroughput.builder()
                .readCapacityUnits(5L)
                .writeCapacityUnits(5L)
                .build())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private void configureTTL(String tableName, String ttlAttributeName) {
        try {
            logger.info("Configuring TTL for table {} on attribute {}", tableName, ttlAttributeName);
            dynamoDbClient.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                .tableName(tableName)
                .timeToLiveSpecification(TimeToLiveSpecification.builder()
                    .attributeName(ttlAttributeName)
                    .enabled(true)
                    .build())
                .build());
        } catch (DynamoDbException e) {
            // Expired sessions are also rejected on read, so a missing TTL only costs storage
            logger.warn("Could not configure TTL for table {} on attribute {}: {}",
                tableName, ttlAttributeName, e.getMessage());
        }
    }
}
