package com.famly.backend.dto;

import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;

import java.time.Instant;

public class PostDTO {

    private String id;
    private String author;      // Username, not id
    private String content;
    private String thread;
    private PostOptions options;
    private Instant createdAt;
    private Instant updatedAt;

    public PostDTO(Post post, String authorName) {
        this.id = post.getPostId();
        this.author = authorName;
        this.content = post.getContent();
        this.thread = post.getThread();
        this.options = post.getOptions();
        this.createdAt = post.getCreatedAt();
        this.updatedAt = post.getUpdatedAt();
    }

    public String getId() {
        return id;
    }

    public String getAuthor() {
        return author;
    }

    public String getContent() {
        return content;
    }

    public String getThread() {
        return thread;
    }

    public PostOptions getOptions() {
        return options;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
