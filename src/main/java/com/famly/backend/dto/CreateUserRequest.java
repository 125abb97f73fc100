package com.famly.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 50, message = "Username must be 50 characters or less")
    private String username;

    @NotBlank(message = "Password is required")
    private String password;

    // Answers to the onboarding question, optional
    private List<String> profileResponses;
}
