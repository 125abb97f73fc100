package com.famly.backend.model;

import com.famly.backend.util.FamlyKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * A post written by one author into exactly one thread.
 *
 * Key Pattern: PK = POST#{PostID}, SK = METADATA
 * GSI Pattern: GSI1PK = AUTHOR#{UserID}, GSI1SK = POST#{createdAtMillis}
 */
@DynamoDbBean
public class Post extends BaseItem {

    private String postId;
    private String author;
    private String content;
    private String thread;
    private PostOptions options;

    // Default constructor for DynamoDB
    public Post() {
        super();
        setItemType(FamlyKeyFactory.POST_PREFIX);
    }

    public Post(String author, String content, String thread, PostOptions options) {
        super();
        setItemType(FamlyKeyFactory.POST_PREFIX);
        this.postId = UUID.randomUUID().toString();
        this.author = author;
        this.content = content;
        this.thread = thread;
        this.options = options;

        setPk(FamlyKeyFactory.getPostPk(this.postId));
        setSk(FamlyKeyFactory.getMetadataSk());

        // Newest-first queries per author
        setGsi1pk(FamlyKeyFactory.getAuthorGsi1Pk(author));
        setGsi1sk(FamlyKeyFactory.getPostGsi1Sk(getCreatedAt()));
    }

    public String getPostId() {
        return postId;
    }

    public void setPostId(String postId) {
        this.postId = postId;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getThread() {
        return thread;
    }

    public void setThread(String thread) {
        this.thread = thread;
    }

    public PostOptions getOptions() {
        return options;
    }

    public void setOptions(PostOptions options) {
        this.options = options;
    }
}
