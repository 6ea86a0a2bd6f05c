package com.architecture.memory.riskscope.dto.risk;

import com.architecture.memory.riskscope.dto.reasoning.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HopRecord {

    private int hop;

    /** Action that was actually executed, after hop-cap enforcement. */
    private ActionType action;

    /** Action the reasoning service asked for, when it differs from the executed one. */
    private ActionType requestedAction;

    private String target;

    private String reasoning;

    /** True when the caller overrode the service (hop cap, timeout, malformed twice). */
    private boolean forced;

    private int attempts;

    private long durationMs;
}
