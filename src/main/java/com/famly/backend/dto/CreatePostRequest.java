package com.famly.backend.dto;

import com.famly.backend.model.PostOptions;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for posting into a thread. {@code id} is the thread id.
 */
@Data
@NoArgsConstructor
public class CreatePostRequest {

    @NotBlank(message = "Post content is required")
    private String content;

    @NotBlank(message = "Thread id is required")
    private String id;

    private PostOptions options;

    public CreatePostRequest(String content, String id, PostOptions options) {
        this.content = content;
        this.id = id;
        this.options = options;
    }
}
