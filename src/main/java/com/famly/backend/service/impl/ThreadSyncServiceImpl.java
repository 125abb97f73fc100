package com.famly.backend.service.impl;

import com.famly.backend.config.ThreadingProperties;
import com.famly.backend.exception.NotAllowedException;
import com.famly.backend.exception.PostAuthorMismatchException;
import com.famly.backend.exception.PostNotFoundException;
import com.famly.backend.exception.ThreadNotFoundException;
import com.famly.backend.exception.ThreadSyncException;
import com.famly.backend.model.DiscussionThread;
import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;
import com.famly.backend.service.PostingService;
import com.famly.backend.service.ThreadSyncService;
import com.famly.backend.service.ThreadingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-step operations over posts and threads. The store gives no cross-item isolation, so a
 * failed second step is undone by hand before the error is reported.
 */
@Service
public class ThreadSyncServiceImpl implements ThreadSyncService {

    private static final Logger logger = LoggerFactory.getLogger(ThreadSyncServiceImpl.class);

    private final ThreadingService threadingService;
    private final PostingService postingService;
    private final ThreadingProperties threadingProperties;

    @Autowired
    public ThreadSyncServiceImpl(ThreadingService threadingService, PostingService postingService,
                                 ThreadingProperties threadingProperties) {
        this.threadingService = threadingService;
        this.postingService = postingService;
        this.threadingProperties = threadingProperties;
    }

    @Override
    public DiscussionThread createThread(String creator, String title, List<String> initialContent,
                                         List<String> initialMembers) {
        DiscussionThread thread = threadingService.createThread(creator, title, List.of(), initialMembers);
        if (initialContent == null || initialContent.isEmpty()) {
            return thread;
        }

        // A timeline may only hold posts whose thread is this one
        List<String> accepted = new ArrayList<>();
        for (Post post : postingService.getManyPostsById(initialContent)) {
            if (thread.getThreadId().equals(post.getThread())) {
                threadingService.appendPost(thread.getThreadId(), post.getPostId());
                accepted.add(post.getPostId());
            }
        }
        if (accepted.size() < initialContent.size()) {
            logger.warn("Dropped {} post ids from new thread {} that belong to other threads or do not exist",
                initialContent.size() - accepted.size(), thread.getThreadId());
        }
        thread.setContent(accepted);
        return thread;
    }

    @Override
    public Post createPost(String author, String threadId, String content, PostOptions options) {
        DiscussionThread thread = threadingService.getThreadContent(threadId);
        if (threadingProperties.isRequireMembershipToPost()
                && !thread.isCreator(author) && !thread.hasMember(author)) {
            throw new NotAllowedException("Only members of thread " + threadId + " can post in it!");
        }

        Post post = postingService.create(author, content, threadId, options);
        try {
            threadingService.appendPost(threadId, post.getPostId());
        } catch (RuntimeException e) {
            logger.error("Failed to add post {} to thread {}, removing the post", post.getPostId(), threadId, e);
            undoCreate(post);
            throw new ThreadSyncException("Failed to add post to thread", e);
        }
        return post;
    }

    @Override
    public String updatePost(String userId, String postId, String content, PostOptions options) {
        postingService.assertAuthorIsUser(postId, userId);
        return postingService.update(postId, content, options);
    }

    @Override
    public String deletePost(String userId, String postId) {
        Post post = postingService.getPostById(postId);
        if (!userId.equals(post.getAuthor())) {
            throw new PostAuthorMismatchException(userId, postId);
        }

        String threadId = post.getThread();
        boolean removedFromThread = false;
        try {
            threadingService.removePost(threadId, postId);
            removedFromThread = true;
        } catch (ThreadNotFoundException e) {
            logger.warn("Thread {} of post {} no longer exists, deleting post only", threadId, postId);
        }

        try {
            return postingService.delete(postId);
        } catch (PostNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to delete post {} after removing it from thread {}", postId, threadId, e);
            if (removedFromThread) {
                undoRemove(threadId, postId);
            }
            throw new ThreadSyncException("Failed to delete post", e);
        }
    }

    @Override
    public String deleteThread(String userId, String threadId) {
        threadingService.assertCreatorIsUser(threadId, userId);
        DiscussionThread thread = threadingService.getThreadContent(threadId);

        int deleted = 0;
        for (Post post : postingService.getManyPostsById(thread.getContent())) {
            // Only posts made in this thread go with it
            if (!threadId.equals(post.getThread())) {
                logger.warn("Thread {} lists post {} of thread {}, leaving it in place",
                    threadId, post.getPostId(), post.getThread());
                continue;
            }
            try {
                postingService.delete(post.getPostId());
                deleted++;
            } catch (PostNotFoundException e) {
                logger.debug("Post {} of thread {} was already gone", post.getPostId(), threadId);
            }
        }

        String message = threadingService.deleteThread(threadId);
        logger.info("User {} deleted thread {} with {} posts", userId, threadId, deleted);
        return message;
    }

    @Override
    public String editThreadTitle(String userId, String threadId, String newTitle) {
        threadingService.assertCreatorIsUser(threadId, userId);
        return threadingService.editThreadTitle(threadId, newTitle);
    }

    @Override
    public List<Post> getThreadPosts(String threadId) {
        DiscussionThread thread = threadingService.getThreadContent(threadId);
        return postingService.getManyPostsById(thread.getContent());
    }

    @Override
    public String joinThread(String userId, String threadId) {
        return threadingService.joinThread(threadId, userId);
    }

    @Override
    public String leaveThread(String userId, String threadId) {
        return threadingService.leaveThread(threadId, userId);
    }

    private void undoCreate(Post post) {
        try {
            postingService.delete(post.getPostId());
        } catch (RuntimeException e) {
            logger.error("Could not remove orphaned post {}", post.getPostId(), e);
        }
    }

    private void undoRemove(String threadId, String postId) {
        try {
            threadingService.appendPost(threadId, postId);
        } catch (RuntimeException e) {
            logger.error("Could not restore post {} to thread {}", postId, threadId, e);
        }
    }
}
