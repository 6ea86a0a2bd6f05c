package com.architecture.memory.riskscope.service.reasoning;

import com.architecture.memory.riskscope.dto.reasoning.DecisionRequest;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationDecision;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisRequest;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;

/**
 * The two structured calls the investigation loop makes. Both block; the caller owns timeouts.
 * Responses are validated before they are returned, anything off-schema raises
 * {@link ReasoningServiceMalformedResponseException}.
 */
public interface ReasoningService {

    InvestigationDecision decide(DecisionRequest request);

    SynthesisResult synthesize(SynthesisRequest request);

    /**
     * False when no model is configured or reasoning is switched off.
     */
    boolean isAvailable();
}
