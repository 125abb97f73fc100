package com.famly.backend.dto;

import com.famly.backend.model.PostOptions;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; omitted fields are left as they are.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePostRequest {

    private String content;

    private PostOptions options;
}
