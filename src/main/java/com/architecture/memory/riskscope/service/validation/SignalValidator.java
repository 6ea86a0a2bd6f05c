package com.architecture.memory.riskscope.service.validation;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.model.SignalStat;

import java.util.List;

/**
 * Single entry point to per-signal validation state. Evaluators only call {@link #state} on the
 * request path, one read per signal.
 */
public interface SignalValidator {

    /**
     * Counts one verdict on a signal and disables it once it proves unreliable.
     *
     * @return the statistic after the update
     */
    SignalStat recordFeedback(SignalName signal, boolean falsePositive, String reason, String filePath);

    /**
     * Enabled with rate 0 for unknown signals and when the store cannot be read.
     */
    SignalState state(SignalName signal);

    default boolean isEnabled(SignalName signal) {
        return state(signal).enabled();
    }

    List<SignalStat> stats();

    /**
     * Manual re-enable. Counters are kept.
     */
    SignalStat enable(SignalName signal);
}
