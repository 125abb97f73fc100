package com.famly.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a thread. Post and member ids arrive comma-joined.
 */
@Data
@NoArgsConstructor
public class CreateThreadRequest {

    @NotBlank(message = "Thread title is required")
    @Size(max = 200, message = "Thread title must be 200 characters or less")
    private String title;

    private String threadContent;

    private String members;

    public CreateThreadRequest(String title, String threadContent, String members) {
        this.title = title;
        this.threadContent = threadContent;
        this.members = members;
    }

    public String getTitle() {
        return title != null ? title.trim() : null;
    }
}
