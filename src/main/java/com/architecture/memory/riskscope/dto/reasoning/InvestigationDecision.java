package com.architecture.memory.riskscope.dto.reasoning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Validated answer to a DECIDE call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationDecision {

    private InvestigationAction action;

    private String reasoning;
}
