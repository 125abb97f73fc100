package com.famly.backend.model;

import com.famly.backend.util.FamlyKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A discussion thread: an ordered timeline of post ids plus a member list.
 *
 * Key Pattern: PK = THREAD#{ThreadID}, SK = METADATA
 *
 * The thread owns both lists. Members have set semantics but are kept as a list so the
 * join order is stable. Content is appended to when a post is created in this thread and
 * shrinks when one is deleted.
 */
@DynamoDbBean
public class DiscussionThread extends BaseItem {

    private String threadId;
    private String creator;
    private String title;
    private List<String> members = new ArrayList<>();
    private List<String> content = new ArrayList<>();

    // Default constructor for DynamoDB
    public DiscussionThread() {
        super();
        setItemType(FamlyKeyFactory.THREAD_PREFIX);
    }

    public DiscussionThread(String creator, String title, List<String> content, List<String> members) {
        super();
        setItemType(FamlyKeyFactory.THREAD_PREFIX);
        this.threadId = UUID.randomUUID().toString();
        this.creator = creator;
        this.title = title;
        this.content = new ArrayList<>(content);
        this.members = new ArrayList<>(members);

        setPk(FamlyKeyFactory.getThreadPk(this.threadId));
        setSk(FamlyKeyFactory.getMetadataSk());
    }

    public String getThreadId() {
        return threadId;
    }

    public void setThreadId(String threadId) {
        this.threadId = threadId;
    }

    public String getCreator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = creator;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<String> getMembers() {
        return members;
    }

    public void setMembers(List<String> members) {
        this.members = members != null ? new ArrayList<>(members) : new ArrayList<>();
    }

    public List<String> getContent() {
        return content;
    }

    public void setContent(List<String> content) {
        this.content = content != null ? new ArrayList<>(content) : new ArrayList<>();
    }

    public boolean isCreator(String userId) {
        return creator != null && creator.equals(userId);
    }

    public boolean hasMember(String userId) {
        return members.contains(userId);
    }
}
