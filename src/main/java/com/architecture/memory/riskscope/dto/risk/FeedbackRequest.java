package com.architecture.memory.riskscope.dto.risk;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User verdict on a signal that fired for some assessment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotBlank
    private String signalName;

    @NotNull
    private Boolean falsePositive;

    private String reason;

    private String filePath;
}
