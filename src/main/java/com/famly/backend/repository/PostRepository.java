package com.famly.backend.repository;

import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;

import java.util.List;
import java.util.Optional;

/**
 * Repository for post items in the FamlyTable.
 */
public interface PostRepository {

    Post create(Post post);

    Optional<Post> findById(String postId);

    /**
     * Partial update. A null argument leaves that attribute unchanged.
     *
     * @throws com.famly.backend.exception.PostNotFoundException if the post does not exist
     */
    void update(String postId, String content, PostOptions options);

    /**
     * @throws com.famly.backend.exception.PostNotFoundException if the post was already gone
     */
    void delete(String postId);

    // Newest first, via UserIndex
    List<Post> findByAuthor(String userId);

    List<Post> findAll();

    /**
     * Batch read. Results follow the order of the given ids; ids with no post are skipped.
     */
    List<Post> findAllByIds(List<String> postIds);
}
