package com.architecture.memory.riskscope.service.reasoning;

/**
 * A reasoning call did not answer within its timeout. Treated as an implicit FINALIZE.
 */
public class ReasoningServiceTimeoutException extends ReasoningServiceException {

    public ReasoningServiceTimeoutException(String message) {
        super(message);
    }

    public ReasoningServiceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
