package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfile;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * OR rule over the three baseline values against the selected profile's thresholds. With the
 * default profile this reads {@code coupling > 10 OR maxCoChange > 0.7 OR testRatio < 0.3}.
 * Unknown or disabled values never trigger escalation on their own.
 */
@Component
public class EscalationRule {

    public boolean shouldEscalate(Map<String, SignalResult> signals, RiskProfile profile) {
        return shouldEscalate(
                valueOf(signals, SignalName.COUPLING),
                valueOf(signals, SignalName.CO_CHANGE),
                valueOf(signals, SignalName.TEST_RATIO),
                profile);
    }

    public static boolean shouldEscalate(Double coupling, Double maxCoChange, Double testRatio,
                                         RiskProfile profile) {
        return (coupling != null && coupling > profile.getCouplingThreshold())
                || (maxCoChange != null && maxCoChange > profile.getCoChangeThreshold())
                || (testRatio != null && testRatio < profile.getTestRatioThreshold());
    }

    private static Double valueOf(Map<String, SignalResult> signals, SignalName name) {
        SignalResult result = signals.get(name.getWireName());
        return result != null && result.isComputed() ? result.getValue() : null;
    }
}
