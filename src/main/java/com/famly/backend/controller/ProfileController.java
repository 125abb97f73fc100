package com.famly.backend.controller;

import com.famly.backend.dto.ProfileDTO;
import com.famly.backend.dto.UpdateProfileRequest;
import com.famly.backend.service.ProfilingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/profile")
@Tag(name = "Profile", description = "Answers to the onboarding question")
@SecurityRequirement(name = "Bearer Authentication")
public class ProfileController extends BaseController {

    @Autowired
    private ProfilingService profilingService;

    @GetMapping
    @Operation(summary = "Get the current user's answers")
    public ResponseEntity<ProfileDTO> getProfile(HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(new ProfileDTO(profilingService.getUserResponses(userId)));
    }

    @PatchMapping
    @Operation(summary = "Replace the current user's answers")
    public ResponseEntity<Map<String, String>> updateProfile(@Valid @RequestBody UpdateProfileRequest request,
                                                             HttpServletRequest httpRequest) {
        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(Map.of("msg", profilingService.updateProfile(userId, request.getSelectedChoices())));
    }

    @GetMapping("/question")
    @Operation(summary = "Get the onboarding question and its choices")
    public ResponseEntity<Map<String, Object>> getQuestion() {
        return ResponseEntity.ok(Map.of(
            "question", profilingService.getQuestion(),
            "options", profilingService.getOptions()
        ));
    }
}
