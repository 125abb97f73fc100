package com.famly.backend.controller;

import com.famly.backend.dto.LoginRequest;
import com.famly.backend.dto.UserDTO;
import com.famly.backend.model.User;
import com.famly.backend.service.SessionService;
import com.famly.backend.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Session", description = "Login and logout")
public class SessionController extends BaseController {

    private final SessionService sessionService;
    private final UserService userService;

    @Autowired
    public SessionController(SessionService sessionService, UserService userService) {
        this.sessionService = sessionService;
        this.userService = userService;
    }

    @GetMapping("/session")
    @Operation(summary = "Get the logged-in user")
    public ResponseEntity<UserDTO> getSessionUser(HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(new UserDTO(userService.getUserById(userId)));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Returns a bearer token for a new session")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest request,
                                                     HttpServletRequest httpRequest) {
        sessionService.isLoggedOut(httpRequest);
        User user = userService.authenticate(request.getUsername(), request.getPassword());
        String token = sessionService.start(user.getId().toString());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("msg", "Logged in!");
        response.put("accessToken", token);
        response.put("tokenType", "Bearer");
        response.put("expiresIn", sessionService.getTtlSeconds());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Ends the session; its token stops working")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest httpRequest) {
        extractUserId(httpRequest);
        sessionService.end(sessionService.getSessionId(httpRequest));
        return ResponseEntity.ok(Map.of("msg", "Logged out!"));
    }
}
