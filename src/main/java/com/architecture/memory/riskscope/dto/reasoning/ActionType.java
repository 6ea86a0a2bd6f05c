package com.architecture.memory.riskscope.dto.reasoning;

public enum ActionType {
    CALCULATE_SIGNAL,
    EXPAND_CONTEXT,
    FINALIZE
}
