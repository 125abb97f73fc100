package com.famly.backend.service.impl;

import com.famly.backend.config.ThreadingProperties;
import com.famly.backend.exception.ThreadCreatorMismatchException;
import com.famly.backend.exception.ThreadNotFoundException;
import com.famly.backend.exception.ValidationException;
import com.famly.backend.model.DiscussionThread;
import com.famly.backend.repository.ThreadRepository;
import com.famly.backend.repository.ThreadRepository.ListAttribute;
import com.famly.backend.service.ThreadingService;
import com.famly.backend.util.FamlyKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Service
public class ThreadingServiceImpl implements ThreadingService {

    private static final Logger logger = LoggerFactory.getLogger(ThreadingServiceImpl.class);

    private final ThreadRepository threadRepository;
    private final ThreadingProperties threadingProperties;

    @Autowired
    public ThreadingServiceImpl(ThreadRepository threadRepository, ThreadingProperties threadingProperties) {
        this.threadRepository = threadRepository;
        this.threadingProperties = threadingProperties;
    }

    @Override
    public DiscussionThread createThread(String creator, String title, List<String> initialContent,
                                         List<String> initialMembers) {
        FamlyKeyFactory.validateId(creator, "User");
        validateTitle(title);

        DiscussionThread thread = new DiscussionThread(creator, title.trim(),
            distinct(initialContent), distinct(initialMembers));
        threadRepository.create(thread);

        logger.info("User {} created thread {} with {} posts and {} members",
            creator, thread.getThreadId(), thread.getContent().size(), thread.getMembers().size());
        return thread;
    }

    @Override
    public DiscussionThread getThreadContent(String threadId) {
        return threadRepository.findById(threadId)
            .orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    @Override
    public String editThreadTitle(String threadId, String newTitle) {
        validateTitle(newTitle);
        threadRepository.updateTitle(threadId, newTitle.trim());
        logger.info("Updated title of thread {}", threadId);
        return "Thread title successfully updated!";
    }

    @Override
    public String deleteThread(String threadId) {
        threadRepository.delete(threadId);
        return "Thread deleted successfully!";
    }

    @Override
    public String joinThread(String threadId, String userId) {
        if (threadRepository.appendToList(threadId, ListAttribute.MEMBERS, userId)) {
            logger.info("User {} joined thread {}", userId, threadId);
        }
        return "Joined thread!";
    }

    @Override
    public String leaveThread(String threadId, String userId) {
        if (threadRepository.removeFromList(threadId, ListAttribute.MEMBERS, userId)) {
            logger.info("User {} left thread {}", userId, threadId);
        }
        return "Left thread!";
    }

    @Override
    public void assertCreatorIsUser(String threadId, String userId) {
        DiscussionThread thread = getThreadContent(threadId);
        if (!thread.isCreator(userId)) {
            throw new ThreadCreatorMismatchException(userId, threadId);
        }
    }

    @Override
    public void appendPost(String threadId, String postId) {
        threadRepository.appendToList(threadId, ListAttribute.CONTENT, postId);
    }

    @Override
    public void removePost(String threadId, String postId) {
        threadRepository.removeFromList(threadId, ListAttribute.CONTENT, postId);
    }

    private void validateTitle(String title) {
        if (title == null || title.trim().isEmpty()) {
            throw new ValidationException("Thread title is required");
        }
        if (title.trim().length() > threadingProperties.getMaxTitleLength()) {
            throw new ValidationException("Thread title must be " + threadingProperties.getMaxTitleLength()
                + " characters or less");
        }
    }

    private List<String> distinct(List<String> ids) {
        if (ids == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(new LinkedHashSet<>(ids));
    }
}
