package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.BaselineResult;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.CancellationSignal;
import com.architecture.memory.riskscope.service.signal.profile.ProfileSelection;
import com.architecture.memory.riskscope.service.signal.profile.RiskProfileSelector;
import com.architecture.memory.riskscope.service.validation.SignalState;
import com.architecture.memory.riskscope.service.validation.SignalValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tier-1: runs the baseline signals for one file concurrently, joins them against a shared
 * deadline and applies the escalation rule with the file's risk profile. A slow or failing
 * signal becomes UNKNOWN; the evaluation as a whole never fails because of one signal.
 *
 * <p>Signals are submitted as plain tasks so that a timeout or a cancelled request interrupts
 * the worker running them.</p>
 */
@Slf4j
@Service
public class BaselineEvaluator {

    private final List<SignalCalculator> calculators;
    private final SignalValidator signalValidator;
    private final EscalationRule escalationRule;
    private final RiskProfileSelector profileSelector;
    private final AsyncTaskExecutor executor;
    private final RiskScopeProperties properties;

    public BaselineEvaluator(List<SignalCalculator> calculators,
                             SignalValidator signalValidator,
                             EscalationRule escalationRule,
                             RiskProfileSelector profileSelector,
                             @Qualifier("tier1SignalExecutor") AsyncTaskExecutor executor,
                             RiskScopeProperties properties) {
        this.calculators = calculators.stream()
                .filter(c -> !c.name().isOnDemand())
                .sorted(Comparator.comparing(SignalCalculator::name))
                .toList();
        this.signalValidator = signalValidator;
        this.escalationRule = escalationRule;
        this.profileSelector = profileSelector;
        this.executor = executor;
        this.properties = properties;
    }

    public BaselineResult evaluate(String filePath, CancellationSignal cancellation) {
        long start = System.currentTimeMillis();
        long timeoutNanos = properties.getTier1().getSignalTimeout().toNanos();
        long deadline = System.nanoTime() + timeoutNanos;

        Map<SignalName, Future<SignalResult>> running = new LinkedHashMap<>();
        Map<SignalName, SignalState> states = new LinkedHashMap<>();
        List<String> disabled = new ArrayList<>();
        for (SignalCalculator calculator : calculators) {
            SignalName name = calculator.name();
            SignalState state = signalValidator.state(name);
            if (!state.enabled()) {
                disabled.add(name.getWireName());
                continue;
            }
            Future<SignalResult> future = executor.submit(() -> calculator.calculate(filePath));
            cancellation.register(future);
            running.put(name, future);
            states.put(name, state);
        }

        Map<String, SignalResult> signals = new LinkedHashMap<>();
        for (Map.Entry<SignalName, Future<SignalResult>> entry : running.entrySet()) {
            SignalName name = entry.getKey();
            Future<SignalResult> future = entry.getValue();
            SignalResult result = join(name, filePath, future, deadline, timeoutNanos);
            cancellation.release(future);
            if (result.isComputed()) {
                result = result.toBuilder().falsePositiveRate(states.get(name).fpRate()).build();
            }
            signals.put(name.getWireName(), result);
        }

        ProfileSelection selection = profileSelector.select(filePath);
        boolean escalate = escalationRule.shouldEscalate(signals, selection.getProfile());
        long durationMs = System.currentTimeMillis() - start;
        log.debug("[Tier1] {} evaluated in {}ms: escalate={}, profile={}, computed={}/{}, disabled={}",
                filePath, durationMs, escalate, selection.getProfile().getKey(),
                signals.values().stream().filter(SignalResult::isComputed).count(), signals.size(), disabled);

        return BaselineResult.builder()
                .filePath(filePath)
                .riskLevel(escalate ? RiskLevel.HIGH : RiskLevel.LOW)
                .escalate(escalate)
                .signals(signals)
                .disabledSignals(disabled)
                .durationMs(durationMs)
                .riskProfile(selection.getProfile().getKey())
                .profileReason(selection.getReason())
                .build();
    }

    private SignalResult join(SignalName name, String filePath, Future<SignalResult> future,
                              long deadline, long timeoutNanos) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tier1] {} for {} timed out after {}ms", name.getWireName(), filePath,
                    TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
            return SignalResult.unknown(name, filePath, "timed out");
        } catch (CancellationException e) {
            return SignalResult.unknown(name, filePath, "cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SignalResult.unknown(name, filePath, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Tier1] {} for {} failed: {}", name.getWireName(), filePath, cause.getMessage());
            return SignalResult.unknown(name, filePath, "computation failed");
        }
    }
}
