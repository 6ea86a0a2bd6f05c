package com.architecture.memory.riskscope.service.reasoning;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.reasoning.DecisionRequest;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationDecision;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisRequest;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;
import com.architecture.memory.riskscope.dto.risk.EvidenceItem;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link ReasoningService} backed by a langchain4j chat model.
 */
@Slf4j
@Service
public class LlmReasoningService implements ReasoningService {

    private static final String DECISION_SYSTEM_PROMPT = """
You are the decision step of a code-change risk investigation.

You are given Tier-1 signals for one changed file (structural coupling, co-change frequency,
test ratio) and the evidence gathered so far. Choose exactly ONE next action:

- CALCULATE_SIGNAL: compute one on-demand signal. "target" must be one of the available signals.
  ownership_churn      - how recently the file changed owners
  incident_similarity  - how closely recent commits resemble past production incidents
- EXPAND_CONTEXT: load the 2-hop graph neighborhood. Allowed at most once; use it rarely.
- FINALIZE: stop and let the evidence be synthesized.

RULES:
- Reason ONLY from the provided signals and evidence. Do NOT invent files, owners or incidents.
- Do not request a signal that is not listed as available.
- FINALIZE as soon as the evidence is sufficient. The investigation is hard-capped at the stated hop limit.

Respond with a JSON object and nothing else:
{"action": "CALCULATE_SIGNAL" | "EXPAND_CONTEXT" | "FINALIZE", "reasoning": "<one or two sentences>", "target": "<signal name or null>"}
""";

    private static final String SYNTHESIS_SYSTEM_PROMPT = """
You are the synthesis step of a code-change risk investigation.

Given every signal and the full evidence chain for one changed file, produce the final assessment.

RULES:
- risk_level is LOW, MEDIUM or HIGH.
- confidence is a number between 0.0 and 1.0 reflecting how strongly the evidence supports the level.
  Few or unknown signals mean low confidence.
- key_evidence lists the facts from the evidence chain that drove the level, quoted concretely.
- recommendations are concrete review actions for this change (files to check, tests to add, people to ask).
- Reason ONLY from the provided evidence.

Respond with a JSON object and nothing else:
{"risk_level": "...", "confidence": 0.0, "key_evidence": ["..."], "recommendations": ["..."], "reasoning_text": "..."}
""";

    private static final String STRICT_SUFFIX = """

Your previous answer could not be parsed. Return ONLY the JSON object: no markdown, no code fence,
no comments, no extra fields, every field present with the exact names and types shown above.
""";

    private final ObjectProvider<ChatLanguageModel> chatLanguageModel;
    private final ReasoningResponseParser parser;
    private final RiskScopeProperties properties;

    public LlmReasoningService(ObjectProvider<ChatLanguageModel> chatLanguageModel,
                               ObjectMapper objectMapper,
                               RiskScopeProperties properties) {
        this.chatLanguageModel = chatLanguageModel;
        this.parser = new ReasoningResponseParser(objectMapper);
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        return properties.getReasoning().isEnabled() && chatLanguageModel.getIfAvailable() != null;
    }

    @Override
    public InvestigationDecision decide(DecisionRequest request) {
        String system = request.isStrict() ? DECISION_SYSTEM_PROMPT + STRICT_SUFFIX : DECISION_SYSTEM_PROMPT;
        String raw = call(system, decisionPrompt(request), "decide");
        InvestigationDecision decision = parser.parseDecision(raw);
        log.debug("[Investigation] Hop {} decision for {}: {} {}", request.getHop(), request.getFilePath(),
                decision.getAction().getType(), decision.getAction().targetName() != null ? decision.getAction().targetName() : "");
        return decision;
    }

    @Override
    public SynthesisResult synthesize(SynthesisRequest request) {
        String system = request.isStrict() ? SYNTHESIS_SYSTEM_PROMPT + STRICT_SUFFIX : SYNTHESIS_SYSTEM_PROMPT;
        String raw = call(system, synthesisPrompt(request), "synthesize");
        return parser.parseSynthesis(raw);
    }

    private String call(String systemPrompt, String userPrompt, String operation) {
        ChatLanguageModel model = properties.getReasoning().isEnabled() ? chatLanguageModel.getIfAvailable() : null;
        if (model == null) {
            throw new ReasoningServiceUnavailableException("No reasoning model configured");
        }
        List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt));
        Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (RuntimeException e) {
            throw translate(operation, e);
        }
        if (response == null || response.content() == null || response.content().text() == null) {
            throw new ReasoningServiceMalformedResponseException("empty " + operation + " response", null);
        }
        return response.content().text();
    }

    /**
     * Maps client failures onto the reasoning error taxonomy by looking through the cause chain.
     */
    static ReasoningServiceException translate(String operation, RuntimeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof InterruptedIOException) {
                return new ReasoningServiceTimeoutException(operation + " timed out: " + t.getMessage(), e);
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException) {
                return new ReasoningServiceUnavailableException(operation + " could not reach the model: " + t.getMessage(), e);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return new ReasoningServiceUnavailableException(operation + " failed: " + e.getMessage(), e);
    }

    private static String decisionPrompt(DecisionRequest request) {
        return String.format("""
                File under investigation: %s
                Changed files in this change set: %s
                Hop: %d of %d (at hop %d only FINALIZE is accepted)
                Context: %d nodes loaded, 2-hop expansion %s

                Tier-1 signals:
                %s

                Evidence so far:
                %s

                Available on-demand signals: %s
                """,
                request.getFilePath(),
                String.join(", ", request.getChangedFiles()),
                request.getHop(), request.getMaxHops(), request.getMaxHops(),
                request.getContextNodeCount(),
                request.isContextExpanded() ? "already used" : "still available",
                renderSignals(request.getBaselineSignals()),
                renderEvidence(request.getEvidenceChain()),
                request.getAvailableSignals().isEmpty() ? "none" : String.join(", ", request.getAvailableSignals()));
    }

    private static String synthesisPrompt(SynthesisRequest request) {
        return String.format("""
                File under investigation: %s
                Investigation stopped because: %s

                Signals:
                %s

                Evidence chain:
                %s
                """,
                request.getFilePath(),
                request.getStopReason(),
                renderSignals(request.getSignals()),
                renderEvidence(request.getEvidenceChain()));
    }

    static String renderSignals(List<SignalResult> signals) {
        if (signals.isEmpty()) {
            return "- none";
        }
        return signals.stream()
                .map(s -> String.format("- %s: %s%s (false-positive rate %.2f) %s",
                        s.getName().getWireName(),
                        s.getStatus(),
                        s.isComputed() ? " " + s.getSignalLevel() + " value=" + s.getValue() : "",
                        s.getFalsePositiveRate(),
                        s.getEvidenceText() == null ? "" : "- " + s.getEvidenceText()))
                .collect(Collectors.joining("\n"));
    }

    static String renderEvidence(List<EvidenceItem> evidence) {
        if (evidence.isEmpty()) {
            return "- none";
        }
        return evidence.stream()
                .map(e -> String.format("%d. [hop %d, %s%s] %s",
                        e.getSequence(), e.getHop(), e.getKind(),
                        e.getLevel() != null ? ", " + e.getLevel() : "",
                        e.getDescription()))
                .collect(Collectors.joining("\n"));
    }
}
