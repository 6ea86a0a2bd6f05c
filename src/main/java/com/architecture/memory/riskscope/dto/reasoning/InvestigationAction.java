package com.architecture.memory.riskscope.dto.reasoning;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Closed set of things the reasoning service may ask for:
 * {@code CalculateSignal(name)}, {@code ExpandContext} or {@code Finalize}.
 * Only the factory methods create instances, so a CALCULATE_SIGNAL always carries an
 * on-demand signal and the other two never carry one.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class InvestigationAction {

    private static final InvestigationAction EXPAND = new InvestigationAction(ActionType.EXPAND_CONTEXT, null);
    private static final InvestigationAction FINALIZE = new InvestigationAction(ActionType.FINALIZE, null);

    private final ActionType type;
    private final SignalName signal;

    private InvestigationAction(ActionType type, SignalName signal) {
        this.type = type;
        this.signal = signal;
    }

    public static InvestigationAction calculateSignal(SignalName signal) {
        Objects.requireNonNull(signal, "signal");
        if (!signal.isOnDemand()) {
            throw new IllegalArgumentException("Not an on-demand signal: " + signal.getWireName());
        }
        return new InvestigationAction(ActionType.CALCULATE_SIGNAL, signal);
    }

    public static InvestigationAction expandContext() {
        return EXPAND;
    }

    public static InvestigationAction finalizeInvestigation() {
        return FINALIZE;
    }

    public String targetName() {
        return signal != null ? signal.getWireName() : null;
    }
}
