package com.famly.backend.repository;

import com.famly.backend.model.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Repository
public class UserRepository {

    private final DynamoDbTable<User> userTable;
    private final DynamoDbIndex<User> usernameIndex;

    @Autowired
    public UserRepository(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.userTable = dynamoDbEnhancedClient.table("Users", TableSchema.fromBean(User.class));
        this.usernameIndex = userTable.index("UsernameIndex");
    }

    public User save(User user) {
        userTable.putItem(user);
        return user;
    }

    public Optional<User> findById(UUID id) {
        User user = userTable.getItem(Key.builder().partitionValue(id.toString()).build());
        return Optional.ofNullable(user);
    }

    public Optional<User> findByUsername(String username) {
        return usernameIndex.query(QueryConditional.keyEqualTo(Key.builder()
                .partitionValue(username)
                .build()))
                .stream()
                .flatMap(page -> page.items().stream())
                .findFirst();
    }

    public List<User> findAll() {
        return userTable.scan().items().stream().collect(Collectors.toList());
    }

    public void delete(User user) {
        userTable.deleteItem(user);
    }
}
