package com.architecture.memory.riskscope.service.validation;

/**
 * The validation store could not be read or written. Never blocks a risk response.
 */
public class ValidatorWriteException extends RuntimeException {

    public ValidatorWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
