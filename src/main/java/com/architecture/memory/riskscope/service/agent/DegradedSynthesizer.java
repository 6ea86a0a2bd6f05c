package com.architecture.memory.riskscope.service.agent;

import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Heuristic synthesis used when the reasoning service can't be relied on:
 * two or more HIGH signals is HIGH, exactly one is MEDIUM, none is LOW. Confidence is always 0.
 */
@Component
public class DegradedSynthesizer {

    public SynthesisResult synthesize(String filePath, Collection<SignalResult> signals, String cause) {
        List<SignalResult> high = signals.stream().filter(SignalResult::isHigh).toList();
        RiskLevel level = levelFor(high.size());
        long computed = signals.stream().filter(SignalResult::isComputed).count();

        String text = String.format(
                "Heuristic assessment without deep investigation (%s): %d of %d computed signals are HIGH for %s, so risk is %s.",
                cause, high.size(), computed, filePath, level.getLabel());

        return SynthesisResult.builder()
                .riskLevel(level)
                .confidence(0.0)
                .keyEvidence(high.stream().map(SignalResult::getEvidenceText).toList())
                .recommendations(recommendations(filePath, high))
                .reasoningText(text)
                .build();
    }

    static RiskLevel levelFor(int highSignals) {
        if (highSignals >= 2) {
            return RiskLevel.HIGH;
        }
        return highSignals == 1 ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }

    /**
     * One concrete review action per HIGH signal.
     */
    public static List<String> recommendations(String filePath, Collection<SignalResult> highSignals) {
        return highSignals.stream()
                .map(s -> recommendation(filePath, s))
                .toList();
    }

    private static String recommendation(String filePath, SignalResult signal) {
        SignalName name = signal.getName();
        Map<String, Object> details = signal.getDetails();
        switch (name) {
            case COUPLING:
                return String.format("Review the %.0f files that depend on %s before merging", signal.getValue(), filePath);
            case CO_CHANGE:
                Object partners = details.get("partners");
                if (partners instanceof Map<?, ?> map && !map.isEmpty()) {
                    Object partner = map.keySet().iterator().next();
                    return String.format("Check whether %s also needs changes; it usually changes together with %s",
                            partner, filePath);
                }
                return "Check the files that usually change together with " + filePath;
            case TEST_RATIO:
                return String.format("Add or extend tests for %s (test ratio %.2f)", filePath, signal.getValue());
            case OWNERSHIP_CHURN:
                Object previous = details.get("previousOwner");
                return previous != null
                        ? String.format("Ask %s, the previous owner of %s, to review", previous, filePath)
                        : "Ask the previous owner of " + filePath + " to review";
            case INCIDENT_SIMILARITY:
                Object title = details.get("topIncidentTitle");
                return title != null
                        ? String.format("Compare this change against past incident \"%s\"", title)
                        : "Compare this change against similar past incidents";
            default:
                return "Review " + filePath + " for " + name.getWireName();
        }
    }
}
