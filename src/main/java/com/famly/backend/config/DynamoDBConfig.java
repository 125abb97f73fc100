package com.famly.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB clients for the famly tables, built from {@link DynamoDBProperties}.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    private final DynamoDBProperties properties;

    public DynamoDBConfig(DynamoDBProperties properties) {
        this.properties = properties;
    }

    @Bean
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentialsProvider())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(properties.getApiCallTimeout())
                        .build());

        if (properties.isLocal()) {
            logger.info("Using DynamoDB Local at {}", properties.getEndpoint());
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        } else {
            logger.info("Using DynamoDB in region {}", properties.getRegion());
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    AwsCredentialsProvider credentialsProvider() {
        if (properties.isLocal()) {
            // DynamoDB Local ignores the key pair but the signer needs one
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("famly-local", "famly-local"));
        }
        return DefaultCredentialsProvider.create();
    }
}
