package com.famly.backend.testutil;

import com.famly.backend.exception.PostNotFoundException;
import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;
import com.famly.backend.repository.PostRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Post store backed by a map.
 */
public class InMemoryPostRepository implements PostRepository {

    private final Map<String, Post> posts = new ConcurrentHashMap<>();

    @Override
    public Post create(Post post) {
        posts.put(post.getPostId(), post);
        return post;
    }

    @Override
    public Optional<Post> findById(String postId) {
        return Optional.ofNullable(posts.get(postId));
    }

    @Override
    public void update(String postId, String content, PostOptions options) {
        Post post = posts.get(postId);
        if (post == null) {
            throw new PostNotFoundException(postId);
        }
        if (content != null) {
            post.setContent(content);
        }
        if (options != null) {
            post.setOptions(options);
        }
    }

    @Override
    public void delete(String postId) {
        if (posts.remove(postId) == null) {
            throw new PostNotFoundException(postId);
        }
    }

    @Override
    public List<Post> findByAuthor(String userId) {
        return posts.values().stream()
            .filter(post -> userId.equals(post.getAuthor()))
            .sorted(Comparator.comparing(Post::getCreatedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<Post> findAll() {
        return posts.values().stream()
            .sorted(Comparator.comparing(Post::getCreatedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<Post> findAllByIds(List<String> postIds) {
        return postIds.stream()
            .map(posts::get)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }

    public boolean contains(String postId) {
        return posts.containsKey(postId);
    }
}
