package com.famly.backend.repository.impl;

import com.famly.backend.config.ThreadingProperties;
import com.famly.backend.exception.RepositoryException;
import com.famly.backend.exception.ThreadNotFoundException;
import com.famly.backend.exception.VersionConflictException;
import com.famly.backend.model.DiscussionThread;
import com.famly.backend.repository.ThreadRepository.ListAttribute;
import com.famly.backend.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
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
class ThreadRepositoryImplTest {

    private static final String TABLE_NAME = "FamlyTable";

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private ThreadRepositoryImpl repository;

    private String creatorId;
    private String memberA;
    private String memberB;
    private String memberC;

    @BeforeEach
    void setUp() {
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> supplier = invocation.getArgument(2);
            return supplier.get();
        });

        ThreadingProperties properties = new ThreadingProperties();
        properties.setMaxUpdateRetries(3);
        repository = new ThreadRepositoryImpl(dynamoDbClient, performanceTracker, properties);

        creatorId = UUID.randomUUID().toString();
        memberA = UUID.randomUUID().toString();
        memberB = UUID.randomUUID().toString();
        memberC = UUID.randomUUID().toString();
    }

    private DiscussionThread thread(List<String> members) {
        return new DiscussionThread(creatorId, "Family reunion", List.of(), members);
    }

    private GetItemResponse found(DiscussionThread thread) {
        return GetItemResponse.builder()
            .item(TableSchema.fromBean(DiscussionThread.class).itemToMap(thread, true))
            .build();
    }

    private ConditionalCheckFailedException conditionFailed() {
        return ConditionalCheckFailedException.builder().message("The conditional request failed").build();
    }

    @Nested
    class Create {

        @Test
        void create_WritesConditionallyOnAbsentKey() {
            DiscussionThread thread = thread(List.of(memberA));
            when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

            repository.create(thread);

            ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
            verify(dynamoDbClient).putItem(captor.capture());
            PutItemRequest request = captor.getValue();
            assertThat(request.tableName()).isEqualTo(TABLE_NAME);
            assertThat(request.conditionExpression()).isEqualTo("attribute_not_exists(pk)");
            assertThat(request.item().get("pk").s()).isEqualTo("THREAD#" + thread.getThreadId());
            assertThat(request.item().get("sk").s()).isEqualTo("METADATA");
            assertThat(request.item().get("members").l()).extracting(AttributeValue::s).containsExactly(memberA);
        }

        @Test
        void create_WithDynamoDbException_ThrowsRepositoryException() {
            when(dynamoDbClient.putItem(any(PutItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("DynamoDB error").build());

            assertThatThrownBy(() -> repository.create(thread(List.of())))
                .isInstanceOf(RepositoryException.class)
                .hasMessageContaining("Failed to create thread")
                .hasCauseInstanceOf(DynamoDbException.class);
        }
    }

    @Nested
    class FindById {

        @Test
        void findById_WithExistingThread_MapsListsInOrder() {
            DiscussionThread stored = thread(List.of(memberB, memberA));
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));

            Optional<DiscussionThread> result = repository.findById(stored.getThreadId());

            assertThat(result).isPresent();
            assertThat(result.get().getTitle()).isEqualTo("Family reunion");
            assertThat(result.get().getMembers()).containsExactly(memberB, memberA);
        }

        @Test
        void findById_WithMissingThread_ReturnsEmpty() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            assertThat(repository.findById(UUID.randomUUID().toString())).isEmpty();
        }
    }

    @Nested
    class UpdateTitle {

        @Test
        void updateTitle_SetsOnlyTitleAndTimestamp() {
            String threadId = UUID.randomUUID().toString();
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

            repository.updateTitle(threadId, "New title");

            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbClient).updateItem(captor.capture());
            assertThat(captor.getValue().updateExpression()).isEqualTo("SET title = :title, updatedAt = :now");
            assertThat(captor.getValue().conditionExpression()).isEqualTo("attribute_exists(pk)");
            assertThat(captor.getValue().expressionAttributeValues().get(":title").s()).isEqualTo("New title");
        }

        @Test
        void updateTitle_WhenThreadMissing_ThrowsThreadNotFound() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenThrow(conditionFailed());

            assertThatThrownBy(() -> repository.updateTitle(UUID.randomUUID().toString(), "New title"))
                .isInstanceOf(ThreadNotFoundException.class);
        }
    }

    @Nested
    class AppendToList {

        @Test
        void appendToList_UsesListAppendGuardedByContains() {
            String threadId = UUID.randomUUID().toString();
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

            boolean appended = repository.appendToList(threadId, ListAttribute.MEMBERS, memberA);

            assertThat(appended).isTrue();
            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbClient).updateItem(captor.capture());
            UpdateItemRequest request = captor.getValue();
            assertThat(request.updateExpression()).contains("list_append(if_not_exists(#list, :empty), :value)");
            assertThat(request.conditionExpression()).isEqualTo("attribute_exists(pk) AND NOT contains(#list, :id)");
            assertThat(request.expressionAttributeNames()).containsEntry("#list", "members");
            assertThat(request.expressionAttributeValues().get(":id").s()).isEqualTo(memberA);
            verify(dynamoDbClient, never()).getItem(any(GetItemRequest.class));
        }

        @Test
        void appendToList_WhenValueAlreadyPresent_IsNoOp() {
            DiscussionThread stored = thread(List.of(memberA));
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenThrow(conditionFailed());
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));

            boolean appended = repository.appendToList(stored.getThreadId(), ListAttribute.MEMBERS, memberA);

            assertThat(appended).isFalse();
        }

        @Test
        void appendToList_WhenThreadMissing_ThrowsThreadNotFound() {
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenThrow(conditionFailed());
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            assertThatThrownBy(() ->
                repository.appendToList(UUID.randomUUID().toString(), ListAttribute.CONTENT, memberA))
                .isInstanceOf(ThreadNotFoundException.class);
        }
    }

    @Nested
    class RemoveFromList {

        @Test
        void removeFromList_RemovesSlotOfValueWithCompareAndSwap() {
            DiscussionThread stored = thread(List.of(memberA, memberB, memberC));
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenReturn(UpdateItemResponse.builder().build());

            boolean removed = repository.removeFromList(stored.getThreadId(), ListAttribute.MEMBERS, memberB);

            assertThat(removed).isTrue();
            ArgumentCaptor<UpdateItemRequest> captor = ArgumentCaptor.forClass(UpdateItemRequest.class);
            verify(dynamoDbClient).updateItem(captor.capture());
            assertThat(captor.getValue().updateExpression()).contains("REMOVE #list[1]");
            assertThat(captor.getValue().conditionExpression()).isEqualTo("#list[1] = :id");
            assertThat(captor.getValue().expressionAttributeValues().get(":id").s()).isEqualTo(memberB);
        }

        @Test
        void removeFromList_WhenValueAbsent_DoesNotWrite() {
            DiscussionThread stored = thread(List.of(memberA));
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));

            boolean removed = repository.removeFromList(stored.getThreadId(), ListAttribute.MEMBERS, memberC);

            assertThat(removed).isFalse();
            verify(dynamoDbClient, never()).updateItem(any(UpdateItemRequest.class));
        }

        @Test
        void removeFromList_WhenSlotMovedOnce_RereadsAndSucceeds() {
            DiscussionThread stored = thread(List.of(memberA, memberB));
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class)))
                .thenThrow(conditionFailed())
                .thenReturn(UpdateItemResponse.builder().build());

            boolean removed = repository.removeFromList(stored.getThreadId(), ListAttribute.MEMBERS, memberB);

            assertThat(removed).isTrue();
            verify(dynamoDbClient, times(2)).getItem(any(GetItemRequest.class));
            verify(dynamoDbClient, times(2)).updateItem(any(UpdateItemRequest.class));
        }

        @Test
        void removeFromList_WhenContentionPersists_ThrowsVersionConflict() {
            DiscussionThread stored = thread(List.of(memberA));
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(found(stored));
            when(dynamoDbClient.updateItem(any(UpdateItemRequest.class))).thenThrow(conditionFailed());

            assertThatThrownBy(() -> repository.removeFromList(stored.getThreadId(), ListAttribute.MEMBERS, memberA))
                .isInstanceOf(VersionConflictException.class);
            verify(dynamoDbClient, times(3)).updateItem(any(UpdateItemRequest.class));
        }

        @Test
        void removeFromList_WhenThreadMissing_ThrowsThreadNotFound() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            assertThatThrownBy(() ->
                repository.removeFromList(UUID.randomUUID().toString(), ListAttribute.CONTENT, memberA))
                .isInstanceOf(ThreadNotFoundException.class);
        }
    }
}
