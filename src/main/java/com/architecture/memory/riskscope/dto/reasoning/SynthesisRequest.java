package com.architecture.memory.riskscope.dto.reasoning;

import com.architecture.memory.riskscope.dto.risk.EvidenceItem;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynthesisRequest {

    private String filePath;

    @Builder.Default
    private List<SignalResult> signals = new ArrayList<>();

    @Builder.Default
    private List<EvidenceItem> evidenceChain = new ArrayList<>();

    private String stopReason;

    private boolean strict;
}
