package com.famly.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the FamlyTable and Users tables.
 * A non-blank endpoint points the client at DynamoDB Local.
 */
@Component
@ConfigurationProperties(prefix = "famly.dynamodb")
public class DynamoDBProperties {

    private String region = "us-east-1";

    private String endpoint = "";

    // Upper bound for one call including SDK retries
    private Duration apiCallTimeout = Duration.ofSeconds(10);

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public Duration getApiCallTimeout() {
        return apiCallTimeout;
    }

    public void setApiCallTimeout(Duration apiCallTimeout) {
        this.apiCallTimeout = apiCallTimeout;
    }

    public boolean isLocal() {
        return endpoint != null && !endpoint.isBlank();
    }
}
