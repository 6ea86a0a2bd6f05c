package com.architecture.memory.riskscope.service.reasoning;

import lombok.Getter;

/**
 * The reasoning service answered, but not with a valid decision or synthesis object.
 */
@Getter
public class ReasoningServiceMalformedResponseException extends ReasoningServiceException {

    private final String rawResponse;

    public ReasoningServiceMalformedResponseException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public ReasoningServiceMalformedResponseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }
}
