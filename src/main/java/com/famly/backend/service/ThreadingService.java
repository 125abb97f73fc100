package com.famly.backend.service;

import com.famly.backend.model.DiscussionThread;

import java.util.List;

/**
 * Owns discussion threads: their title, their ordered post timeline and their member list.
 * Does not know what a post is beyond its id.
 */
public interface ThreadingService {

    /**
     * Stores the lists as given. Request paths go through {@link ThreadSyncService#createThread},
     * which keeps only post ids that belong to the new thread.
     */
    DiscussionThread createThread(String creator, String title, List<String> initialContent, List<String> initialMembers);

    DiscussionThread getThreadContent(String threadId);

    String editThreadTitle(String threadId, String newTitle);

    String deleteThread(String threadId);

    String joinThread(String threadId, String userId);

    String leaveThread(String threadId, String userId);

    void assertCreatorIsUser(String threadId, String userId);

    // Timeline maintenance, driven by post creation and deletion
    void appendPost(String threadId, String postId);

    void removePost(String threadId, String postId);
}
