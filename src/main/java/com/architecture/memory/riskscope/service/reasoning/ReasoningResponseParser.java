package com.architecture.memory.riskscope.service.reasoning;

import com.architecture.memory.riskscope.dto.reasoning.ActionType;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationAction;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationDecision;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Strict validation of reasoning-service JSON. Unknown fields, missing fields, wrong types and
 * out-of-range values are all rejected; nothing free-form reaches the investigation loop.
 *
 * <pre>
 * decision:  {"action": "CALCULATE_SIGNAL|EXPAND_CONTEXT|FINALIZE", "reasoning": "...", "target": "ownership_churn"}
 * synthesis: {"risk_level": "LOW|MEDIUM|HIGH", "confidence": 0.0-1.0, "key_evidence": [...],
 *             "recommendations": [...], "reasoning_text": "..."}
 * </pre>
 */
public class ReasoningResponseParser {

    static final Set<String> DECISION_FIELDS = Set.of("action", "reasoning", "target");
    static final Set<String> SYNTHESIS_FIELDS =
            Set.of("risk_level", "confidence", "key_evidence", "recommendations", "reasoning_text");

    private final ObjectMapper objectMapper;

    public ReasoningResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InvestigationDecision parseDecision(String raw) {
        JsonNode root = readObject(raw, DECISION_FIELDS);

        String actionText = requiredText(root, "action", raw);
        ActionType type = parseActionType(actionText)
                .orElseThrow(() -> malformed("unknown action '" + actionText + "'", raw));
        String reasoning = requiredText(root, "reasoning", raw);
        JsonNode target = root.get("target");
        boolean hasTarget = target != null && !target.isNull();

        InvestigationAction action;
        switch (type) {
            case CALCULATE_SIGNAL -> {
                if (!hasTarget || !target.isTextual()) {
                    throw malformed("CALCULATE_SIGNAL requires a target signal name", raw);
                }
                SignalName signal = SignalName.fromWireName(target.asText())
                        .filter(SignalName::isOnDemand)
                        .orElseThrow(() -> malformed("target '" + target.asText() + "' is not an on-demand signal", raw));
                action = InvestigationAction.calculateSignal(signal);
            }
            case EXPAND_CONTEXT -> {
                rejectTarget(hasTarget, type, raw);
                action = InvestigationAction.expandContext();
            }
            default -> {
                rejectTarget(hasTarget, type, raw);
                action = InvestigationAction.finalizeInvestigation();
            }
        }
        return InvestigationDecision.builder()
                .action(action)
                .reasoning(reasoning)
                .build();
    }

    public SynthesisResult parseSynthesis(String raw) {
        JsonNode root = readObject(raw, SYNTHESIS_FIELDS);

        String levelText = requiredText(root, "risk_level", raw);
        RiskLevel level = RiskLevel.parseStrict(levelText);
        if (level == null) {
            throw malformed("unknown risk_level '" + levelText + "'", raw);
        }

        JsonNode confidence = root.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw malformed("confidence must be a number", raw);
        }
        double value = confidence.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw malformed("confidence " + value + " outside [0,1]", raw);
        }

        return SynthesisResult.builder()
                .riskLevel(level)
                .confidence(value)
                .keyEvidence(stringArray(root, "key_evidence", raw))
                .recommendations(stringArray(root, "recommendations", raw))
                .reasoningText(requiredText(root, "reasoning_text", raw))
                .build();
    }

    /**
     * Drops a surrounding markdown code fence, if any.
     */
    static String stripFence(String raw) {
        String text = raw.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private JsonNode readObject(String raw, Set<String> allowed) {
        if (raw == null || raw.isBlank()) {
            throw malformed("empty response", raw);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(raw));
        } catch (JsonProcessingException e) {
            throw new ReasoningServiceMalformedResponseException("response is not valid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (root == null || !root.isObject()) {
            throw malformed("response is not a JSON object", raw);
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw malformed("unexpected field '" + name + "'", raw);
            }
        }
        return root;
    }

    private static Optional<ActionType> parseActionType(String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (ActionType type : ActionType.values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static void rejectTarget(boolean hasTarget, ActionType type, String raw) {
        if (hasTarget) {
            throw malformed(type + " must not carry a target", raw);
        }
    }

    private static String requiredText(JsonNode root, String field, String raw) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw malformed("'" + field + "' must be a non-empty string", raw);
        }
        return node.asText().trim();
    }

    private static List<String> stringArray(JsonNode root, String field, String raw) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw malformed("'" + field + "' must be an array of strings", raw);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw malformed("'" + field + "' must be an array of strings", raw);
            }
            values.add(item.asText());
        }
        return values;
    }

    private static ReasoningServiceMalformedResponseException malformed(String message, String raw) {
        return new ReasoningServiceMalformedResponseException(message, raw);
    }
}
