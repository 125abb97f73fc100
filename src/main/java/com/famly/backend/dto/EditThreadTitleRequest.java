package com.famly.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditThreadTitleRequest {

    @NotBlank(message = "Thread title is required")
    @Size(max = 200, message = "Thread title must be 200 characters or less")
    private String title;
}
