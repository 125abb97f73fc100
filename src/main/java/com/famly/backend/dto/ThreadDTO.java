package com.famly.backend.dto;

import com.famly.backend.model.DiscussionThread;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thread as returned to clients, with user ids replaced by usernames.
 */
public class ThreadDTO {

    private String id;
    private String creator;
    private String title;
    private List<String> members;
    private List<String> content;   // Post ids, oldest first
    private Instant createdAt;
    private Instant updatedAt;

    public ThreadDTO(DiscussionThread thread, Map<String, String> usernames) {
        this.id = thread.getThreadId();
        this.creator = usernames.getOrDefault(thread.getCreator(), thread.getCreator());
        this.title = thread.getTitle();
        this.members = thread.getMembers().stream()
            .map(member -> usernames.getOrDefault(member, member))
            .collect(Collectors.toList());
        this.content = List.copyOf(thread.getContent());
        this.createdAt = thread.getCreatedAt();
        this.updatedAt = thread.getUpdatedAt();
    }

    public String getId() {
        return id;
    }

    public String getCreator() {
        return creator;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getMembers() {
        return members;
    }

    public List<String> getContent() {
        return content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
