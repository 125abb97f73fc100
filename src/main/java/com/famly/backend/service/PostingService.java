package com.famly.backend.service;

import com.famly.backend.model.Post;
import com.famly.backend.model.PostOptions;

import java.util.List;

public interface PostingService {

    Post create(String author, String content, String threadId, PostOptions options);

    String update(String postId, String content, PostOptions options);

    String delete(String postId);

    void assertAuthorIsUser(String postId, String userId);

    Post getPostById(String postId);

    List<Post> getByAuthor(String authorId);

    List<Post> getPosts();

    /**
     * Posts in the order of the given ids. Ids without a post are skipped.
     */
    List<Post> getManyPostsById(List<String> postIds);
}
