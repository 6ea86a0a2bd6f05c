package com.architecture.memory.riskscope.service.validation;

/**
 * Enabled flag and current false-positive rate of one signal, read together.
 */
public record SignalState(boolean enabled, double fpRate) {

    /** Used for signals without feedback and when the store cannot be read. */
    public static SignalState enabledByDefault() {
        return new SignalState(true, 0.0);
    }
}
