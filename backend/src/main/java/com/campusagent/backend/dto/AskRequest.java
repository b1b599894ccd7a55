package com.campusagent.backend.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for asking the assistant a question.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

    @NotBlank
    @Size(max = 2000)
    @Schema(description = "Free-text question", example = "Where can I study quietly on campus?")
    private String prompt;
}
