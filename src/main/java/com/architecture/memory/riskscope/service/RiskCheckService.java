package com.architecture.memory.riskscope.service;

import com.architecture.memory.riskscope.dto.risk.BaselineResult;
import com.architecture.memory.riskscope.dto.risk.RiskAssessment;
import com.architecture.memory.riskscope.dto.risk.RiskCheckReport;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.agent.InvestigationAgent;
import com.architecture.memory.riskscope.service.signal.BaselineEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for a risk check over a changed-file set: Tier-1 for every file, Phase-2
 * investigation for the escalated ones. Each file is assessed in isolation; one file failing
 * never aborts the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskCheckService {

    private final BaselineEvaluator baselineEvaluator;
    private final InvestigationAgent investigationAgent;

    public RiskCheckReport check(List<String> changedFiles) {
        return check(changedFiles, CancellationSignal.none());
    }

    public RiskCheckReport check(List<String> changedFiles, CancellationSignal cancellation) {
        List<String> files = normalize(changedFiles);
        String checkId = UUID.randomUUID().toString();
        long start = System.currentTimeMillis();
        log.info("[RiskCheck] {} started for {} files", checkId, files.size());

        List<RiskAssessment> assessments = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String file : files) {
            if (cancellation.isCancelled()) {
                failures.put(file, "cancelled");
                continue;
            }
            try {
                assessments.add(assess(file, files, cancellation));
            } catch (RuntimeException e) {
                log.error("[RiskCheck] {} assessment of {} failed: {}", checkId, file, e.getMessage(), e);
                failures.put(file, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        RiskLevel overall = assessments.stream()
                .map(RiskAssessment::getRiskLevel)
                .reduce(RiskLevel.LOW, RiskLevel::max);
        long durationMs = System.currentTimeMillis() - start;
        log.info("[RiskCheck] {} finished in {}ms: overall {}, {} assessed, {} failed{}",
                checkId, durationMs, overall, assessments.size(), failures.size(),
                cancellation.isCancelled() ? " (cancelled)" : "");

        return RiskCheckReport.builder()
                .checkId(checkId)
                .overallRiskLevel(overall)
                .assessments(assessments)
                .failures(failures)
                .cancelled(cancellation.isCancelled())
                .durationMs(durationMs)
                .build();
    }

    RiskAssessment assess(String file, List<String> changedFiles, CancellationSignal cancellation) {
        BaselineResult baseline = baselineEvaluator.evaluate(file, cancellation);
        if (baseline.isEscalate()) {
            log.info("[Tier1] {} escalated: {}", file, highSignals(baseline));
            return investigationAgent.investigate(baseline, changedFiles, cancellation);
        }
        return lowRisk(baseline);
    }

    /**
     * Non-escalated file: LOW, confidence is the share of baseline signals that produced a value.
     */
    static RiskAssessment lowRisk(BaselineResult baseline) {
        int ran = baseline.getSignals().size();
        double confidence = ran == 0 ? 0.0 : (double) baseline.computedCount() / ran;
        List<String> evidence = baseline.getSignals().values().stream()
                .map(SignalResult::getEvidenceText)
                .toList();
        return RiskAssessment.builder()
                .filePath(baseline.getFilePath())
                .riskLevel(RiskLevel.LOW)
                .confidence(confidence)
                .escalated(false)
                .signals(new LinkedHashMap<>(baseline.getSignals()))
                .disabledSignals(baseline.getDisabledSignals())
                .riskProfile(baseline.getRiskProfile())
                .profileReason(baseline.getProfileReason())
                .keyEvidence(evidence)
                .reasoningText(String.format("No baseline signal crossed its escalation threshold (%d of %d computed).",
                        baseline.computedCount(), ran))
                .build();
    }

    private static String highSignals(BaselineResult baseline) {
        return baseline.getSignals().values().stream()
                .filter(SignalResult::isHigh)
                .map(s -> s.getName().getWireName() + "=" + s.getValue())
                .collect(Collectors.joining(", "));
    }

    private static List<String> normalize(List<String> changedFiles) {
        if (changedFiles == null || changedFiles.isEmpty()) {
            throw new IllegalArgumentException("changedFiles must not be empty");
        }
        LinkedHashSet<String> files = new LinkedHashSet<>();
        for (String file : changedFiles) {
            if (file == null || file.isBlank()) {
                throw new IllegalArgumentException("changedFiles must not contain blank paths");
            }
            files.add(file.trim());
        }
        return List.copyOf(files);
    }
}
