package com.architecture.memory.riskscope.dto.ingest;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Notification that an incident was linked (AFFECTS) to one or more files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentLinkRequest {

    @NotBlank
    private String incidentId;

    @NotEmpty
    private List<String> filePaths;
}
