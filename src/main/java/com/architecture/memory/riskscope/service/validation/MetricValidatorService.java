package com.architecture.memory.riskscope.service.validation;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.model.FeedbackEvent;
import com.architecture.memory.riskscope.model.SignalStat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks false-positive rates per signal and switches off the unreliable ones.
 *
 * <p>A signal is disabled exactly when {@code totalUses >= minUses} and {@code fpRate > maxFpRate}.
 * Nothing turns it back on except {@link #enable}.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricValidatorService implements SignalValidator {

    private final SignalStatStore store;
    private final RiskScopeProperties properties;
    private final Clock clock;

    @Override
    public SignalStat recordFeedback(SignalName signal, boolean falsePositive, String reason, String filePath) {
        String name = signal.getWireName();
        SignalStat stat = store.increment(name, falsePositive);

        double fpRate = rate(stat.getFalsePositives(), stat.getTotalUses());
        stat.setFpRate(fpRate);
        store.updateRate(name, stat.getTotalUses(), fpRate);

        appendAudit(name, falsePositive, reason, filePath);

        RiskScopeProperties.Validation limits = properties.getValidation();
        if (stat.isEnabled() && stat.getTotalUses() >= limits.getMinUses() && fpRate > limits.getMaxFpRate()) {
            String why = String.format("fp_rate %.4f > %.4f after %d uses", fpRate, limits.getMaxFpRate(), stat.getTotalUses());
            if (store.disable(name, why)) {
                log.info("[Validator] Signal {} auto-disabled: {}", name, why);
            }
            stat.setEnabled(false);
            stat.setDisabledReason(why);
        }
        log.debug("[Validator] {} feedback on {}: uses={}, fp={}, rate={}",
                falsePositive ? "False-positive" : "True-positive", name,
                stat.getTotalUses(), stat.getFalsePositives(), fpRate);
        return stat;
    }

    @Override
    public SignalState state(SignalName signal) {
        try {
            return store.find(signal.getWireName())
                    .map(stat -> new SignalState(stat.isEnabled(), stat.getFpRate()))
                    .orElseGet(SignalState::enabledByDefault);
        } catch (ValidatorWriteException e) {
            log.warn("[Validator] Could not read state of {}, assuming enabled: {}", signal.getWireName(), e.getMessage());
            return SignalState.enabledByDefault();
        }
    }

    /**
     * Every known signal, including those that never received feedback.
     */
    @Override
    public List<SignalStat> stats() {
        Map<String, SignalStat> byName = new LinkedHashMap<>();
        Arrays.stream(SignalName.values()).forEach(s -> byName.put(s.getWireName(), SignalStat.empty(s.getWireName())));
        store.findAll().forEach(stat -> byName.put(stat.getName(), stat));
        return List.copyOf(byName.values());
    }

    @Override
    public SignalStat enable(SignalName signal) {
        SignalStat stat = store.enable(signal.getWireName());
        log.info("[Validator] Signal {} manually re-enabled (uses={}, fp_rate={})",
                signal.getWireName(), stat.getTotalUses(), stat.getFpRate());
        return stat;
    }

    private void appendAudit(String name, boolean falsePositive, String reason, String filePath) {
        try {
            store.recordEvent(FeedbackEvent.builder()
                    .signalName(name)
                    .filePath(filePath)
                    .falsePositive(falsePositive)
                    .reason(reason)
                    .recordedAt(clock.instant())
                    .build());
        } catch (ValidatorWriteException e) {
            log.warn("[Validator] Feedback audit entry for {} lost: {}", name, e.getMessage());
        }
    }

    static double rate(long falsePositives, long totalUses) {
        return totalUses == 0 ? 0.0 : (double) falsePositives / totalUses;
    }
}
