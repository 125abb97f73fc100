package com.famly.backend.controller;

import com.famly.backend.dto.CreatePostRequest;
import com.famly.backend.dto.DtoMapper;
import com.famly.backend.dto.PostDTO;
import com.famly.backend.dto.UpdatePostRequest;
import com.famly.backend.model.Post;
import com.famly.backend.model.User;
import com.famly.backend.service.PostingService;
import com.famly.backend.service.ThreadSyncService;
import com.famly.backend.service.UserService;
import com.famly.backend.util.FamlyKeyFactory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/posts")
@Tag(name = "Posts", description = "Posts inside threads")
public class PostController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(PostController.class);

    private final PostingService postingService;
    private final ThreadSyncService threadSyncService;
    private final UserService userService;
    private final DtoMapper dtoMapper;

    @Autowired
    public PostController(PostingService postingService, ThreadSyncService threadSyncService,
                          UserService userService, DtoMapper dtoMapper) {
        this.postingService = postingService;
        this.threadSyncService = threadSyncService;
        this.userService = userService;
        this.dtoMapper = dtoMapper;
    }

    @GetMapping
    @Operation(summary = "List posts, newest first, optionally only those by one author")
    public ResponseEntity<List<PostDTO>> getPosts(@RequestParam(required = false) String author) {
        List<Post> posts;
        if (author != null) {
            User user = userService.getUserByUsername(author);
            posts = postingService.getByAuthor(user.getId().toString());
        } else {
            posts = postingService.getPosts();
        }
        return ResponseEntity.ok(dtoMapper.toPostDTOs(posts));
    }

    @PostMapping
    @Operation(summary = "Create a post in a thread")
    public ResponseEntity<Map<String, Object>> createPost(@Valid @RequestBody CreatePostRequest request,
                                                          HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(request.getId(), "Thread");

        Post post = threadSyncService.createPost(userId, request.getId(), request.getContent(), request.getOptions());
        logger.info("User {} posted {} in thread {}", userId, post.getPostId(), request.getId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("msg", "Post successfully created!");
        response.put("post", dtoMapper.toPostDTO(post));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Edit a post's content or options")
    public ResponseEntity<Map<String, String>> updatePost(@PathVariable String id,
                                                          @RequestBody UpdatePostRequest request,
                                                          HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(id, "Post");
        return ResponseEntity.ok(Map.of("msg",
            threadSyncService.updatePost(userId, id, request.getContent(), request.getOptions())));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a post and remove it from its thread")
    public ResponseEntity<Map<String, String>> deletePost(@PathVariable String id, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(id, "Post");
        return ResponseEntity.ok(Map.of("msg", threadSyncService.deletePost(userId, id)));
    }
}
