package com.architecture.memory.riskscope.dto.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One link of an investigation's evidence chain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvidenceItem {

    public enum Kind {
        BASELINE_SIGNAL,
        SIGNAL,
        CONTEXT,
        DECISION,
        NOTE
    }

    private int sequence;

    /**
     * Hop that produced this item; 0 for baseline evidence and initial context.
     */
    private int hop;

    private Kind kind;

    private String signalName;

    private RiskLevel level;

    private String description;

    private Instant recordedAt;
}
