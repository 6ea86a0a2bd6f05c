package com.architecture.memory.riskscope.dto.reasoning;

import com.architecture.memory.riskscope.dto.risk.EvidenceItem;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the reasoning service sees when choosing the next action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRequest {

    private String filePath;

    @Builder.Default
    private List<String> changedFiles = new ArrayList<>();

    @Builder.Default
    private List<SignalResult> baselineSignals = new ArrayList<>();

    @Builder.Default
    private List<EvidenceItem> evidenceChain = new ArrayList<>();

    /**
     * On-demand signals that are enabled and not yet computed.
     */
    @Builder.Default
    private List<String> availableSignals = new ArrayList<>();

    private int hop;

    private int maxHops;

    private boolean contextExpanded;

    private int contextNodeCount;

    /**
     * Retry after a malformed answer: the prompt carries a stricter formatting instruction.
     */
    private boolean strict;
}
