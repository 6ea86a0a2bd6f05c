package com.architecture.memory.riskscope.service.agent;

/**
 * INIT → DECIDE → {CALCULATE_SIGNAL | EXPAND_CONTEXT} → DECIDE → … → FINALIZE → SYNTHESIZE → DONE
 */
public enum InvestigationState {
    INIT,
    DECIDE,
    CALCULATE_SIGNAL,
    EXPAND_CONTEXT,
    FINALIZE,
    SYNTHESIZE,
    DONE
}
