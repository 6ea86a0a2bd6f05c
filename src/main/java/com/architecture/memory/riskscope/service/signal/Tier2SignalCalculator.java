package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.validation.SignalState;
import com.architecture.memory.riskscope.service.validation.SignalValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * On-demand signals requested by the investigation loop.
 */
@Slf4j
@Service
public class Tier2SignalCalculator {

    private final Map<SignalName, SignalCalculator> calculators = new EnumMap<>(SignalName.class);
    private final SignalValidator signalValidator;

    public Tier2SignalCalculator(List<SignalCalculator> calculators, SignalValidator signalValidator) {
        calculators.stream()
                .filter(c -> c.name().isOnDemand())
                .forEach(c -> this.calculators.put(c.name(), c));
        this.signalValidator = signalValidator;
    }

    /**
     * @throws IllegalArgumentException for a baseline signal or one without a calculator
     */
    public SignalResult calculate(SignalName name, String filePath) {
        SignalCalculator calculator = calculators.get(name);
        if (calculator == null) {
            throw new IllegalArgumentException("Not an on-demand signal: " + name.getWireName());
        }
        SignalState state = signalValidator.state(name);
        if (!state.enabled()) {
            log.debug("[Tier2] {} is disabled, skipping for {}", name.getWireName(), filePath);
            return SignalResult.disabled(name, filePath);
        }
        SignalResult result = calculator.calculate(filePath);
        if (result.isComputed()) {
            result = result.toBuilder().falsePositiveRate(state.fpRate()).build();
        }
        return result;
    }

    /**
     * On-demand signals that are currently enabled.
     */
    public List<SignalName> available() {
        return calculators.keySet().stream()
                .filter(signalValidator::isEnabled)
                .toList();
    }
}
