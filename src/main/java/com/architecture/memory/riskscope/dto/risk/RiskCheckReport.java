package com.architecture.memory.riskscope.dto.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one risk check over a changed-file set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskCheckReport {

    private String checkId;

    /**
     * Highest level across the assessed files; LOW when nothing could be assessed.
     */
    private RiskLevel overallRiskLevel;

    @Builder.Default
    private List<RiskAssessment> assessments = new ArrayList<>();

    /**
     * Files whose assessment failed, with the failure message. Other files are unaffected.
     */
    @Builder.Default
    private Map<String, String> failures = new LinkedHashMap<>();

    private boolean cancelled;

    private long durationMs;
}
