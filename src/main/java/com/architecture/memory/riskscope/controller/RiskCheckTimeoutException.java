package com.architecture.memory.riskscope.controller;

import java.time.Duration;

public class RiskCheckTimeoutException extends RuntimeException {

    public RiskCheckTimeoutException(Duration timeout) {
        super("Risk check did not finish within " + timeout.toMillis() + "ms and was cancelled");
    }
}
