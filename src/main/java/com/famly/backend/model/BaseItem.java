package com.famly.backend.model;

import com.famly.backend.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

/**
 * Base class for every concept item stored in the FamlyTable.
 * Carries the keys of the single-table design and the type discriminator used for
 * polymorphic deserialization.
 */
@DynamoDbBean
public abstract class BaseItem {

    private String pk;          // Partition Key
    private String sk;          // Sort Key
    private String gsi1pk;      // UserIndex Partition Key
    private String gsi1sk;      // UserIndex Sort Key
    private String itemType;
    private Instant createdAt;
    private Instant updatedAt;

    public BaseItem() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @DynamoDbPartitionKey
    public String getPk() {
        return pk;
    }

    public void setPk(String pk) {
        this.pk = pk;
    }

    @DynamoDbSortKey
    public String getSk() {
        return sk;
    }

    public void setSk(String sk) {
        this.sk = sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "UserIndex")
    public String getGsi1pk() {
        return gsi1pk;
    }

    public void setGsi1pk(String gsi1pk) {
        this.gsi1pk = gsi1pk;
    }

    @DynamoDbSecondarySortKey(indexNames = "UserIndex")
    public String getGsi1sk() {
        return gsi1sk;
    }

    public void setGsi1sk(String gsi1sk) {
        this.gsi1sk = gsi1sk;
    }

    @DynamoDbAttribute("itemType")
    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Bump updatedAt before a full-item write.
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }
}
