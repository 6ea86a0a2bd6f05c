package com.architecture.memory.riskscope.dto.risk;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One computed signal for one file. Lives in the ephemeral cache for a fixed TTL and in the
 * per-request evidence chain; never written to the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SignalResult {

    private SignalName name;

    private String filePath;

    private SignalStatus status;

    /**
     * Numeric value: coupling count, max co-change frequency, test ratio,
     * days since ownership transition, or top incident BM25 score. Null unless COMPUTED.
     */
    private Double value;

    /**
     * LOW / MEDIUM / HIGH. Null unless COMPUTED.
     */
    private RiskLevel signalLevel;

    private String evidenceText;

    /**
     * False-positive rate observed for this signal by the validator at evaluation time.
     */
    private double falsePositiveRate;

    /**
     * Signal-specific extras (co-change partners, owners, matched incident ids).
     */
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    public boolean isComputed() {
        return status == SignalStatus.COMPUTED;
    }

    public boolean isHigh() {
        return isComputed() && signalLevel == RiskLevel.HIGH;
    }

    public static SignalResult unknown(SignalName name, String filePath, String reason) {
        return SignalResult.builder()
                .name(name)
                .filePath(filePath)
                .status(SignalStatus.UNKNOWN)
                .evidenceText(name.getWireName() + " unknown: " + reason)
                .build();
    }

    public static SignalResult disabled(SignalName name, String filePath) {
        return SignalResult.builder()
                .name(name)
                .filePath(filePath)
                .status(SignalStatus.DISABLED)
                .evidenceText(name.getWireName() + " disabled by validation feedback")
                .build();
    }
}
