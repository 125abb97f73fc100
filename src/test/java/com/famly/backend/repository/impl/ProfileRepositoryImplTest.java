package com.famly.backend.repository.impl;

import com.famly.backend.exception.RepositoryException;
import com.famly.backend.model.ProfileRecord;
import com.famly.backend.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileRepositoryImplTest {

    private static final String TABLE_NAME = "FamlyTable";

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private ProfileRepositoryImpl repository;
    private String userId;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });
        repository = new ProfileRepositoryImpl(dynamoDbClient, performanceTracker);
        userId = UUID.randomUUID().toString();
    }

    @Test
    void save_PutsUnconditionallyUnderUserAndQuestionKey() {
        ProfileRecord record = new ProfileRecord(userId, "goals", "What are your goals in Fam.ly?",
            List.of("Connect more often", "Learn family history"));
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        repository.save(record);

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(captor.capture());
        PutItemRequest request = captor.getValue();
        assertThat(request.tableName()).isEqualTo(TABLE_NAME);
        assertThat(request.conditionExpression()).isNull();
        assertThat(request.item().get("pk").s()).isEqualTo("USER#" + userId);
        assertThat(request.item().get("sk").s()).isEqualTo("PROFILE#goals");
        assertThat(request.item().get("selectedChoices").l()).extracting(AttributeValue::s)
            .containsExactly("Connect more often", "Learn family history");
    }

    @Test
    void find_MapsStoredRecord() {
        ProfileRecord stored = new ProfileRecord(userId, "goals", "What are your goals in Fam.ly?",
            List.of("Learn about identity"));
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder()
            .item(TableSchema.fromBean(ProfileRecord.class).itemToMap(stored, true))
            .build());

        Optional<ProfileRecord> result = repository.find(userId, "goals");

        assertThat(result).isPresent();
        assertThat(result.get().getSelectedChoices()).containsExactly("Learn about identity");
        ArgumentCaptor<GetItemRequest> captor = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(captor.capture());
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("PROFILE#goals");
    }

    @Test
    void find_WithoutRecord_ReturnsEmpty() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(repository.find(userId, "goals")).isEmpty();
    }

    @Test
    void delete_TargetsUserAndQuestionKey() {
        when(dynamoDbClient.deleteItem(any(DeleteItemRequest.class))).thenReturn(DeleteItemResponse.builder().build());

        repository.delete(userId, "goals");

        ArgumentCaptor<DeleteItemRequest> captor = ArgumentCaptor.forClass(DeleteItemRequest.class);
        verify(dynamoDbClient).deleteItem(captor.capture());
        assertThat(captor.getValue().key().get("pk").s()).isEqualTo("USER#" + userId);
        assertThat(captor.getValue().key().get("sk").s()).isEqualTo("PROFILE#goals");
    }

    @Test
    void save_WithDynamoDbException_ThrowsRepositoryException() {
        when(dynamoDbClient.putItem(any(PutItemRequest.class)))
            .thenThrow(DynamoDbException.builder().message("DynamoDB error").build());

        assertThatThrownBy(() -> repository.save(new ProfileRecord(userId, "goals", "q", List.of("a"))))
            .isInstanceOf(RepositoryException.class)
            .hasCauseInstanceOf(DynamoDbException.class);
    }
}
