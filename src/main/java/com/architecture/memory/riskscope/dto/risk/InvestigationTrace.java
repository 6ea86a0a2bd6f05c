package com.architecture.memory.riskscope.dto.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What's left of an investigation after synthesis: kept only in the ephemeral cache so it
 * can be inspected later through the REST API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationTrace {

    private String investigationId;

    private String filePath;

    @Builder.Default
    private List<HopRecord> hops = new ArrayList<>();

    @Builder.Default
    private List<EvidenceItem> evidence = new ArrayList<>();

    private String stopReason;

    private int contextNodeCount;

    private boolean contextExpanded;

    private boolean degraded;

    private Instant startedAt;

    private long durationMs;
}
