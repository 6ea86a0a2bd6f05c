package com.architecture.memory.riskscope.service.reasoning;

/**
 * No reasoning service is configured, or it cannot be reached at all.
 */
public class ReasoningServiceUnavailableException extends ReasoningServiceException {

    public ReasoningServiceUnavailableException(String message) {
        super(message);
    }

    public ReasoningServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
