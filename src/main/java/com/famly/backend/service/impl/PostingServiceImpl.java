package com.famly.backend.service.impl;

import com.famly.backend.exception.PostAuthorMismatchException;
import com.famly.backend.exception.PostNotFoundException;
import com.famly.backend.exception.ValidationException;
import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;
import com.famly.backend.repository.PostRepository;
import com.famly.backend.service.PostingService;
import com.famly.backend.util.FamlyKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PostingServiceImpl implements PostingService {

    private static final Logger logger = LoggerFactory.getLogger(PostingServiceImpl.class);

    private final PostRepository postRepository;

    @Autowired
    public PostingServiceImpl(PostRepository postRepository) {
        this.postRepository = postRepository;
    }

    @Override
    public Post create(String author, String content, String threadId, PostOptions options) {
        if (content == null || content.trim().isEmpty()) {
            throw new ValidationException("Post content is required");
        }
        FamlyKeyFactory.validateId(threadId, "Thread");

        Post post = postRepository.create(new Post(author, content, threadId, options));
        logger.info("User {} created post {}", author, post.getPostId());
        return post;
    }

    @Override
    public String update(String postId, String content, PostOptions options) {
        if (content != null && content.trim().isEmpty()) {
            throw new ValidationException("Post content cannot be blank");
        }
        if (content == null && options == null) {
            // Nothing to change, but the post must still exist
            getPostById(postId);
            return "Post successfully updated!";
        }
        postRepository.update(postId, content, options);
        return "Post successfully updated!";
    }

    @Override
    public String delete(String postId) {
        postRepository.delete(postId);
        return "Post deleted successfully!";
    }

    @Override
    public void assertAuthorIsUser(String postId, String userId) {
        Post post = getPostById(postId);
        if (!userId.equals(post.getAuthor())) {
            throw new PostAuthorMismatchException(userId, postId);
        }
    }

    @Override
    public Post getPostById(String postId) {
        return postRepository.findById(postId)
            .orElseThrow(() -> new PostNotFoundException(postId));
    }

    @Override
    public List<Post> getByAuthor(String authorId) {
        return postRepository.findByAuthor(authorId);
    }

    @Override
    public List<Post> getPosts() {
        return postRepository.findAll();
    }

    @Override
    public List<Post> getManyPostsById(List<String> postIds) {
        return postRepository.findAllByIds(postIds);
    }
}
