package com.architecture.memory.riskscope.service.agent;

import com.architecture.memory.riskscope.dto.risk.BaselineResult;
import com.architecture.memory.riskscope.dto.risk.EvidenceItem;
import com.architecture.memory.riskscope.dto.risk.HopRecord;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import lombok.Getter;
import lombok.Setter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-investigation state. In memory only and discarded after synthesis; the trace built from
 * it is the only thing that outlives the request.
 */
@Getter
public class InvestigationContext {

    private final String investigationId = UUID.randomUUID().toString();
    private final String filePath;
    private final List<String> changedFiles;
    private final BaselineResult baseline;
    private final ContextGraph contextGraph;
    private final int maxHops;
    private final Instant startedAt;
    private final long deadlineNanos;
    private final long decisionDeadlineNanos;
    private final Clock clock;

    private final Map<String, SignalResult> signals = new LinkedHashMap<>();
    private final List<EvidenceItem> evidence = new ArrayList<>();
    private final List<HopRecord> hops = new ArrayList<>();

    @Setter
    private InvestigationState state = InvestigationState.INIT;
    private int hop;
    @Setter
    private String stopReason;
    private boolean timedOut;
    private String degradedReason;

    public InvestigationContext(String filePath, List<String> changedFiles, BaselineResult baseline,
                                ContextGraph contextGraph, int maxHops, long budgetNanos,
                                long synthesisReserveNanos, Clock clock) {
        this.filePath = filePath;
        this.changedFiles = List.copyOf(changedFiles);
        this.baseline = baseline;
        this.contextGraph = contextGraph;
        this.maxHops = maxHops;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadlineNanos = System.nanoTime() + budgetNanos;
        this.decisionDeadlineNanos = deadlineNanos - Math.min(Math.max(0, synthesisReserveNanos), budgetNanos);
        this.signals.putAll(baseline.getSignals());
    }

    /**
     * Starts the next DECIDE iteration.
     *
     * @return the new hop number, 1-based
     */
    public int nextHop() {
        if (hop >= maxHops) {
            throw new IllegalStateException("Hop limit " + maxHops + " reached");
        }
        return ++hop;
    }

    public boolean isLastHop() {
        return hop >= maxHops;
    }

    /** Time left for the whole investigation, synthesis included. */
    public long remainingBudgetNanos() {
        return deadlineNanos - System.nanoTime();
    }

    /** Time left for DECIDE iterations; the synthesis reserve is not part of it. */
    public long remainingDecisionNanos() {
        return decisionDeadlineNanos - System.nanoTime();
    }

    public void addSignal(SignalResult result) {
        signals.put(result.getName().getWireName(), result);
    }

    public boolean hasSignal(SignalName name) {
        return signals.containsKey(name.getWireName());
    }

    public EvidenceItem addEvidence(EvidenceItem.Kind kind, SignalName signal, RiskLevel level, String description) {
        EvidenceItem item = EvidenceItem.builder()
                .sequence(evidence.size() + 1)
                .hop(hop)
                .kind(kind)
                .signalName(signal != null ? signal.getWireName() : null)
                .level(level)
                .description(description)
                .recordedAt(clock.instant())
                .build();
        evidence.add(item);
        return item;
    }

    public void addHop(HopRecord record) {
        hops.add(record);
    }

    public void markTimedOut(String reason) {
        timedOut = true;
        if (stopReason == null) {
            stopReason = reason;
        }
    }

    public void degrade(String reason) {
        if (degradedReason == null) {
            degradedReason = reason;
        }
        if (stopReason == null) {
            stopReason = reason;
        }
    }

    public boolean isDegraded() {
        return degradedReason != null;
    }

    public List<SignalResult> signalList() {
        return Collections.unmodifiableList(new ArrayList<>(signals.values()));
    }

    public List<EvidenceItem> evidenceSnapshot() {
        return List.copyOf(evidence);
    }
}
