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
 * Final assessment for one changed file, returned to the calling CLI/service layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    private String filePath;

    private RiskLevel riskLevel;

    /**
     * 0.0 - 1.0. Zero means no deep investigation backs the level.
     */
    private double confidence;

    private boolean escalated;

    /**
     * True when the reasoning-driven investigation produced the result.
     */
    private boolean investigated;

    /**
     * True when the heuristic fallback produced the result.
     */
    private boolean degraded;

    /**
     * Every signal considered, keyed by wire name.
     */
    @Builder.Default
    private Map<String, SignalResult> signals = new LinkedHashMap<>();

    @Builder.Default
    private List<String> disabledSignals = new ArrayList<>();

    @Builder.Default
    private List<EvidenceItem> evidenceChain = new ArrayList<>();

    @Builder.Default
    private List<String> keyEvidence = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private String reasoningText;

    private String riskProfile;

    private String profileReason;

    /**
     * Id of the cached {@link InvestigationTrace}, when an investigation ran.
     */
    private String investigationId;
}
