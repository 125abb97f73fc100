package com.famly.backend.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.Objects;

/**
 * Optional formatting attached to a post. Stored as a nested map on the post item.
 */
@DynamoDbBean
public class PostOptions {

    private String backgroundColor;

    public PostOptions() {}

    public PostOptions(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public void setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PostOptions)) return false;
        return Objects.equals(backgroundColor, ((PostOptions) o).backgroundColor);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(backgroundColor);
    }
}
