package com.famly.backend.controller;

import com.famly.backend.dto.CreateThreadRequest;
import com.famly.backend.dto.DeleteThreadRequest;
import com.famly.backend.dto.DtoMapper;
import com.famly.backend.dto.EditThreadTitleRequest;
import com.famly.backend.dto.PostDTO;
import com.famly.backend.dto.ThreadDTO;
import com.famly.backend.model.DiscussionThread;
import com.famly.backend.service.ThreadSyncService;
import com.famly.backend.service.ThreadingService;
import com.famly.backend.util.FamlyKeyFactory;
import com.famly.backend.util.IdListParser;
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

/**
 * Thread routes. Membership toggles live under /joinThreads and /leaveThreads.
 */
@RestController
@Tag(name = "Threads", description = "Discussion threads and membership")
public class ThreadController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ThreadController.class);

    private final ThreadingService threadingService;
    private final ThreadSyncService threadSyncService;
    private final DtoMapper dtoMapper;

    @Autowired
    public ThreadController(ThreadingService threadingService, ThreadSyncService threadSyncService,
                            DtoMapper dtoMapper) {
        this.threadingService = threadingService;
        this.threadSyncService = threadSyncService;
        this.dtoMapper = dtoMapper;
    }

    @PostMapping("/threads")
    @Operation(summary = "Create a thread")
    public ResponseEntity<Map<String, Object>> createThread(@Valid @RequestBody CreateThreadRequest request,
                                                            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        List<String> content = IdListParser.parse(request.getThreadContent(), "Post");
        List<String> members = IdListParser.parse(request.getMembers(), "User");

        DiscussionThread thread = threadSyncService.createThread(userId, request.getTitle(), content, members);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("msg", "Thread successfully created!");
        response.put("thread", dtoMapper.toThreadDTO(thread));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/threads")
    @Operation(summary = "Delete a thread and all of its posts")
    public ResponseEntity<Map<String, String>> deleteThread(@Valid @RequestBody DeleteThreadRequest request,
                                                            HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(request.getId(), "Thread");
        logger.info("User {} deleting thread {}", userId, request.getId());
        return ResponseEntity.ok(Map.of("msg", threadSyncService.deleteThread(userId, request.getId())));
    }

    @PatchMapping("/threads/{id}")
    @Operation(summary = "Change a thread's title")
    public ResponseEntity<Map<String, String>> editThreadTitle(@PathVariable String id,
                                                               @Valid @RequestBody EditThreadTitleRequest request,
                                                               HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(id, "Thread");
        return ResponseEntity.ok(Map.of("msg", threadSyncService.editThreadTitle(userId, id, request.getTitle())));
    }

    @GetMapping("/threads/{id}")
    @Operation(summary = "Get the posts of a thread, oldest first")
    public ResponseEntity<List<PostDTO>> getThreadPosts(@PathVariable String id) {
        FamlyKeyFactory.validateId(id, "Thread");
        return ResponseEntity.ok(dtoMapper.toPostDTOs(threadSyncService.getThreadPosts(id)));
    }

    @GetMapping("/threads/{id}/details")
    @Operation(summary = "Get a thread's title, creator, members and timeline")
    public ResponseEntity<ThreadDTO> getThread(@PathVariable String id) {
        FamlyKeyFactory.validateId(id, "Thread");
        return ResponseEntity.ok(dtoMapper.toThreadDTO(threadingService.getThreadContent(id)));
    }

    @PatchMapping("/joinThreads/{id}")
    @Operation(summary = "Join a thread")
    public ResponseEntity<Map<String, String>> joinThread(@PathVariable String id, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(id, "Thread");
        return ResponseEntity.ok(Map.of("msg", threadSyncService.joinThread(userId, id)));
    }

    @PatchMapping("/leaveThreads/{id}")
    @Operation(summary = "Leave a thread")
    public ResponseEntity<Map<String, String>> leaveThread(@PathVariable String id, HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        FamlyKeyFactory.validateId(id, "Thread");
        return ResponseEntity.ok(Map.of("msg", threadSyncService.leaveThread(userId, id)));
    }
}
