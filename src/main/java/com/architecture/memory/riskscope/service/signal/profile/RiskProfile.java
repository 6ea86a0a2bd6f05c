package com.architecture.memory.riskscope.service.signal.profile;

import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Escalation thresholds and level bands for one kind of codebase.
 *
 * <p>The three {@code *Threshold} values drive escalation; the bands below them only split
 * LOW from MEDIUM for display.</p>
 */
@Value
@Builder
public class RiskProfile {

    String key;
    String description;

    /** HIGH above this many coupled files. */
    int couplingThreshold;
    int couplingMediumAbove;

    /** HIGH above this co-change frequency. */
    double coChangeThreshold;
    double coChangeMediumAbove;

    /** HIGH below this test ratio. */
    double testRatioThreshold;
    double testRatioLowFrom;

    public RiskLevel couplingLevel(double coupling) {
        if (coupling > couplingThreshold) {
            return RiskLevel.HIGH;
        }
        return coupling > couplingMediumAbove ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }

    public RiskLevel coChangeLevel(double maxFrequency) {
        if (maxFrequency > coChangeThreshold) {
            return RiskLevel.HIGH;
        }
        return maxFrequency > coChangeMediumAbove ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }

    public RiskLevel testRatioLevel(double ratio) {
        if (ratio < testRatioThreshold) {
            return RiskLevel.HIGH;
        }
        return ratio < testRatioLowFrom ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }
}
