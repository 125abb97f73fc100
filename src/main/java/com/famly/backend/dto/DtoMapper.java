package com.famly.backend.dto;

import com.famly.backend.model.DiscussionThread;
import com.famly.backend.model.Post;
import com.famly.backend.service.UserService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds response DTOs, resolving every user id they mention in one pass.
 */
@Component
public class DtoMapper {

    private final UserService userService;

    @Autowired
    public DtoMapper(UserService userService) {
        this.userService = userService;
    }

    public List<PostDTO> toPostDTOs(List<Post> posts) {
        Set<String> authors = posts.stream()
            .map(Post::getAuthor)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, String> usernames = userService.resolveUsernames(authors);

        return posts.stream()
            .map(post -> new PostDTO(post, usernames.get(post.getAuthor())))
            .collect(Collectors.toList());
    }

    public PostDTO toPostDTO(Post post) {
        return toPostDTOs(List.of(post)).get(0);
    }

    public ThreadDTO toThreadDTO(DiscussionThread thread) {
        List<String> userIds = new ArrayList<>();
        userIds.add(thread.getCreator());
        userIds.addAll(thread.getMembers());
        return new ThreadDTO(thread, userService.resolveUsernames(userIds));
    }
}
