package com.architecture.memory.riskscope.dto.ingest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Notification that a commit has been written to the temporal layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitIngestedRequest {

    @NotBlank
    private String sha;

    private String authorEmail;

    private Instant authoredAt;

    private String message;

    @NotEmpty
    private List<String> files;
}
