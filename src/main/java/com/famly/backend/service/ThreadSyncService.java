package com.famly.backend.service;

import com.famly.backend.model.DiscussionThread;
import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;

import java.util.List;

/**
 * Keeps posts and thread timelines consistent for operations that touch both.
 * Authorization checks run before any write.
 */
public interface ThreadSyncService {

    /**
     * Creates a thread for {@code creator}. Post ids in {@code initialContent} are kept only when
     * the post was made in this thread; any other id is dropped.
     */
    DiscussionThread createThread(String creator, String title, List<String> initialContent,
                                  List<String> initialMembers);

    Post createPost(String author, String threadId, String content, PostOptions options);

    String updatePost(String userId, String postId, String content, PostOptions options);

    String deletePost(String userId, String postId);

    /**
     * Deletes the thread and every post on its timeline that was made in it. Ids of posts from
     * other threads are left alone.
     */
    String deleteThread(String userId, String threadId);

    String editThreadTitle(String userId, String threadId, String newTitle);

    List<Post> getThreadPosts(String threadId);

    String joinThread(String userId, String threadId);

    String leaveThread(String userId, String threadId);
}
