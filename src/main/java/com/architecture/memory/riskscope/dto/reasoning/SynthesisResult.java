package com.architecture.memory.riskscope.dto.reasoning;

import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated answer to a SYNTHESIZE call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynthesisResult {

    private RiskLevel riskLevel;

    private double confidence;

    @Builder.Default
    private List<String> keyEvidence = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private String reasoningText;
}
