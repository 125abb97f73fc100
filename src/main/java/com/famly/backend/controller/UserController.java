package com.famly.backend.controller;

import com.famly.backend.dto.CreateUserRequest;
import com.famly.backend.dto.UpdatePasswordRequest;
import com.famly.backend.dto.UpdateUsernameRequest;
import com.famly.backend.dto.UserDTO;
import com.famly.backend.model.User;
import com.famly.backend.service.ProfilingService;
import com.famly.backend.service.SessionService;
import com.famly.backend.service.UserService;
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
import java.util.stream.Collectors;

@RestController
@RequestMapping("/users")
@Tag(name = "Users", description = "Accounts")
public class UserController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    private final UserService userService;
    private final SessionService sessionService;
    private final ProfilingService profilingService;

    @Autowired
    public UserController(UserService userService, SessionService sessionService, ProfilingService profilingService) {
        this.userService = userService;
        this.sessionService = sessionService;
        this.profilingService = profilingService;
    }

    @GetMapping
    @Operation(summary = "List all users")
    public ResponseEntity<List<UserDTO>> getUsers() {
        return ResponseEntity.ok(userService.getUsers().stream()
            .map(UserDTO::new)
            .collect(Collectors.toList()));
    }

    @GetMapping("/{username}")
    @Operation(summary = "Get a user by username")
    public ResponseEntity<UserDTO> getUser(@PathVariable String username) {
        return ResponseEntity.ok(new UserDTO(userService.getUserByUsername(username)));
    }

    @PostMapping
    @Operation(summary = "Register", description = "Profile answers are checked before the account is created")
    public ResponseEntity<Map<String, Object>> createUser(@Valid @RequestBody CreateUserRequest request,
                                                          HttpServletRequest httpRequest) {
        sessionService.isLoggedOut(httpRequest);
        profilingService.validateChoices(request.getProfileResponses());

        User user = userService.create(request.getUsername(), request.getPassword());
        profilingService.ask(user.getId().toString(), request.getProfileResponses());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("msg", "User created successfully!");
        response.put("user", new UserDTO(user));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PatchMapping("/username")
    @Operation(summary = "Change the current user's username")
    public ResponseEntity<Map<String, String>> updateUsername(@Valid @RequestBody UpdateUsernameRequest request,
                                                              HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(Map.of("msg", userService.updateUsername(userId, request.getUsername())));
    }

    @PatchMapping("/password")
    @Operation(summary = "Change the current user's password")
    public ResponseEntity<Map<String, String>> updatePassword(@Valid @RequestBody UpdatePasswordRequest request,
                                                              HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(Map.of("msg",
            userService.updatePassword(userId, request.getCurrentPassword(), request.getNewPassword())));
    }

    @DeleteMapping
    @Operation(summary = "Delete the current user's account and log out")
    public ResponseEntity<Map<String, String>> deleteUser(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        sessionService.end(sessionService.getSessionId(httpRequest));
        profilingService.deleteProfile(userId);
        String msg = userService.delete(userId);
        logger.info("Account {} deleted", userId);
        return ResponseEntity.ok(Map.of("msg", msg));
    }
}
