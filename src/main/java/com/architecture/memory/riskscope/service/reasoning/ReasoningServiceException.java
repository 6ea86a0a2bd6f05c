package com.architecture.memory.riskscope.service.reasoning;

/**
 * Base type for failures of the external reasoning service.
 */
public class ReasoningServiceException extends RuntimeException {

    public ReasoningServiceException(String message) {
        super(message);
    }

    public ReasoningServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
