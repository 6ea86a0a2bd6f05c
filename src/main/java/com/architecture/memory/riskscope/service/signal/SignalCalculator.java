package com.architecture.memory.riskscope.service.signal;

import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;

/**
 * Computes one named signal for one file. Never throws for graph failures: the result is
 * {@link com.architecture.memory.riskscope.dto.risk.SignalStatus#UNKNOWN} instead.
 */
public interface SignalCalculator {

    SignalName name();

    SignalResult calculate(String filePath);
}
