package com.architecture.memory.riskscope.dto.risk;

public enum SignalStatus {
    /** Value computed (or served from cache). */
    COMPUTED,
    /** Graph unavailable after retry, or the computation timed out. */
    UNKNOWN,
    /** Switched off by the metric validator; absent evidence, never LOW. */
    DISABLED
}
