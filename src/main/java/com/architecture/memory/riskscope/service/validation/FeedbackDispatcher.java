package com.architecture.memory.riskscope.service.validation;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Moves feedback off the request thread. A lost feedback event is logged, never surfaced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedbackDispatcher {

    private final SignalValidator signalValidator;

    @Async
    public void submit(SignalName signal, boolean falsePositive, String reason, String filePath) {
        try {
            signalValidator.recordFeedback(signal, falsePositive, reason, filePath);
        } catch (ValidatorWriteException e) {
            log.warn("[Validator] Dropped feedback for {} ({}): {}",
                    signal.getWireName(), falsePositive ? "false positive" : "true positive", e.getMessage());
        }
    }
}
