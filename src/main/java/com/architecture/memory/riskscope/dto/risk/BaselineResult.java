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
 * Tier-1 outcome for a single changed file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineResult {

    private String filePath;

    /**
     * LOW or HIGH only.
     */
    private RiskLevel riskLevel;

    private boolean escalate;

    /**
     * Signals that ran (COMPUTED or UNKNOWN), keyed by wire name. Disabled signals are not here.
     */
    @Builder.Default
    private Map<String, SignalResult> signals = new LinkedHashMap<>();

    @Builder.Default
    private List<String> disabledSignals = new ArrayList<>();

    private long durationMs;

    /**
     * Key of the threshold profile the escalation rule was applied with.
     */
    private String riskProfile;

    /**
     * How that profile was chosen, e.g. {@code Exact match: language=go, domain=backend, config=go_backend}.
     */
    private String profileReason;

    public SignalResult signal(SignalName name) {
        return signals.get(name.getWireName());
    }

    public long computedCount() {
        return signals.values().stream().filter(SignalResult::isComputed).count();
    }
}
