package com.architecture.memory.riskscope.service.agent;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.reasoning.ActionType;
import com.architecture.memory.riskscope.dto.reasoning.DecisionRequest;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationAction;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationDecision;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisRequest;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;
import com.architecture.memory.riskscope.dto.risk.BaselineResult;
import com.architecture.memory.riskscope.dto.risk.EvidenceItem;
import com.architecture.memory.riskscope.dto.risk.HopRecord;
import com.architecture.memory.riskscope.dto.risk.InvestigationTrace;
import com.architecture.memory.riskscope.dto.risk.RiskAssessment;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.service.CancellationSignal;
import com.architecture.memory.riskscope.service.cache.CacheKeys;
import com.architecture.memory.riskscope.service.cache.SignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import com.architecture.memory.riskscope.service.reasoning.ReasoningService;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceException;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceMalformedResponseException;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceTimeoutException;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceUnavailableException;
import com.architecture.memory.riskscope.service.signal.Tier2SignalCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Phase 2: a bounded, evidence-accumulating decision loop for one escalated file.
 *
 * <p>Driven as an explicit state machine (see {@link InvestigationState}). The loop is strictly
 * sequential and capped at {@code maxHops} DECIDE iterations; whatever the reasoning service asks
 * for at the last hop, the caller finalizes. Every reasoning call has its own timeout and the
 * whole investigation has a wall-clock budget, the tail of which is held back for synthesis.
 * No failure escapes: the worst case is a degraded heuristic assessment with confidence 0.</p>
 */
@Slf4j
@Service
public class InvestigationAgent {

    private final GraphStoreAdapter graph;
    private final ReasoningService reasoningService;
    private final Tier2SignalCalculator tier2;
    private final DegradedSynthesizer degradedSynthesizer;
    private final SignalCache cache;
    private final ExecutorService reasoningExecutor;
    private final RiskScopeProperties properties;
    private final Clock clock;

    public InvestigationAgent(GraphStoreAdapter graph,
                              ReasoningService reasoningService,
                              Tier2SignalCalculator tier2,
                              DegradedSynthesizer degradedSynthesizer,
                              SignalCache cache,
                              @Qualifier("reasoningExecutor") ExecutorService reasoningExecutor,
                              RiskScopeProperties properties,
                              Clock clock) {
        this.graph = graph;
        this.reasoningService = reasoningService;
        this.tier2 = tier2;
        this.degradedSynthesizer = degradedSynthesizer;
        this.cache = cache;
        this.reasoningExecutor = reasoningExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public RiskAssessment investigate(BaselineResult baseline, List<String> changedFiles, CancellationSignal cancellation) {
        String filePath = baseline.getFilePath();
        if (!reasoningService.isAvailable()) {
            log.warn("[Investigation] Reasoning service unavailable, heuristic assessment for {}", filePath);
            SynthesisResult synthesis = degradedSynthesizer.synthesize(
                    filePath, baseline.getSignals().values(), "reasoning service unavailable");
            return assessment(baseline, baseline.getSignals(), List.of(), synthesis, false, true, null);
        }

        RiskScopeProperties.Investigation limits = properties.getInvestigation();
        InvestigationContext ctx = new InvestigationContext(
                filePath, changedFiles, baseline,
                new ContextGraph(graph, limits.getMaxContextDepth()),
                limits.getMaxHops(), limits.getBudget().toNanos(), limits.getSynthesisReserve().toNanos(), clock);
        long start = System.currentTimeMillis();
        log.info("[Investigation] {} started for {}", ctx.getInvestigationId(), filePath);

        InvestigationAction pending = null;
        SynthesisResult synthesis = null;
        while (ctx.getState() != InvestigationState.DONE) {
            switch (ctx.getState()) {
                case INIT -> {
                    init(ctx);
                    ctx.setState(InvestigationState.DECIDE);
                }
                case DECIDE -> {
                    pending = decide(ctx, cancellation);
                    ctx.setState(switch (pending.getType()) {
                        case CALCULATE_SIGNAL -> InvestigationState.CALCULATE_SIGNAL;
                        case EXPAND_CONTEXT -> InvestigationState.EXPAND_CONTEXT;
                        case FINALIZE -> InvestigationState.FINALIZE;
                    });
                }
                case CALCULATE_SIGNAL -> {
                    calculateSignal(ctx, pending.getSignal());
                    ctx.setState(InvestigationState.DECIDE);
                }
                case EXPAND_CONTEXT -> {
                    expandContext(ctx);
                    ctx.setState(InvestigationState.DECIDE);
                }
                case FINALIZE -> {
                    if (ctx.getStopReason() == null) {
                        ctx.setStopReason("reasoning service finalized");
                    }
                    ctx.setState(InvestigationState.SYNTHESIZE);
                }
                case SYNTHESIZE -> {
                    synthesis = synthesize(ctx);
                    ctx.setState(InvestigationState.DONE);
                }
                default -> throw new IllegalStateException("Unexpected state " + ctx.getState());
            }
        }

        long durationMs = System.currentTimeMillis() - start;
        InvestigationTrace trace = InvestigationTrace.builder()
                .investigationId(ctx.getInvestigationId())
                .filePath(filePath)
                .hops(List.copyOf(ctx.getHops()))
                .evidence(ctx.evidenceSnapshot())
                .stopReason(ctx.getStopReason())
                .contextNodeCount(ctx.getContextGraph().size())
                .contextExpanded(ctx.getContextGraph().isExpanded())
                .degraded(ctx.isDegraded())
                .startedAt(ctx.getStartedAt())
                .durationMs(durationMs)
                .build();
        cache.set(CacheKeys.trace(ctx.getInvestigationId()), trace, properties.getCache().getTraceTtl());

        log.info("[Investigation] {} finished for {} after {} hops in {}ms: {} (confidence {}, stop: {})",
                ctx.getInvestigationId(), filePath, ctx.getHops().size(), durationMs,
                synthesis.getRiskLevel(), synthesis.getConfidence(), ctx.getStopReason());

        return assessment(baseline, ctx.getSignals(), ctx.evidenceSnapshot(), synthesis,
                !ctx.isDegraded(), ctx.isDegraded(), ctx.getInvestigationId());
    }

    public Optional<InvestigationTrace> findTrace(String investigationId) {
        return cache.get(CacheKeys.trace(investigationId), InvestigationTrace.class);
    }

    // ---- states ----

    private void init(InvestigationContext ctx) {
        for (SignalResult signal : ctx.getBaseline().getSignals().values()) {
            ctx.addEvidence(EvidenceItem.Kind.BASELINE_SIGNAL, signal.getName(), signal.getSignalLevel(),
                    signal.getEvidenceText());
        }
        ctx.getBaseline().getDisabledSignals().forEach(name ->
                ctx.addEvidence(EvidenceItem.Kind.NOTE, null, null, name + " is disabled and was not evaluated"));
        try {
            int loaded = ctx.getContextGraph().loadInitial(List.of(ctx.getFilePath()));
            ctx.addEvidence(EvidenceItem.Kind.CONTEXT, null, null, String.format(
                    "loaded %d 1-hop neighbors of %s (%d files)",
                    loaded, ctx.getFilePath(), ctx.getContextGraph().files().size()));
        } catch (GraphUnavailableException e) {
            log.warn("[Investigation] {} could not load context for {}: {}",
                    ctx.getInvestigationId(), ctx.getFilePath(), e.getMessage());
            ctx.addEvidence(EvidenceItem.Kind.NOTE, null, null, "graph context unavailable");
        }
    }

    /**
     * One DECIDE iteration. Always returns an executable action; FINALIZE on any failure.
     */
    private InvestigationAction decide(InvestigationContext ctx, CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            ctx.setStopReason("cancelled");
            return InvestigationAction.finalizeInvestigation();
        }
        if (ctx.remainingDecisionNanos() <= 0) {
            ctx.markTimedOut("investigation budget exhausted");
            return InvestigationAction.finalizeInvestigation();
        }

        int hop = ctx.nextHop();
        long hopStart = System.currentTimeMillis();
        HopRecord.HopRecordBuilder record = HopRecord.builder().hop(hop);

        InvestigationDecision decision = null;
        int attempts = 0;
        boolean strict = false;
        while (decision == null) {
            attempts++;
            Duration timeout = min(properties.getInvestigation().getCallTimeout(),
                    Duration.ofNanos(Math.max(0, ctx.remainingDecisionNanos())));
            DecisionRequest request = decisionRequest(ctx, hop, strict);
            try {
                decision = withTimeout(() -> reasoningService.decide(request), timeout);
            } catch (ReasoningServiceMalformedResponseException e) {
                if (!strict) {
                    log.warn("[Investigation] {} hop {}: malformed decision ({}), retrying with strict format",
                            ctx.getInvestigationId(), hop, e.getMessage());
                    strict = true;
                    continue;
                }
                log.warn("[Investigation] {} hop {}: malformed decision again, finalizing with heuristic synthesis",
                        ctx.getInvestigationId(), hop);
                ctx.degrade("reasoning service returned malformed responses");
                return forcedFinalize(ctx, record, null, "malformed decision after strict retry", attempts, hopStart);
            } catch (ReasoningServiceTimeoutException e) {
                log.warn("[Investigation] {} hop {}: decision timed out after {}ms",
                        ctx.getInvestigationId(), hop, timeout.toMillis());
                ctx.markTimedOut("reasoning service timed out at hop " + hop);
                return forcedFinalize(ctx, record, null, "decision timed out", attempts, hopStart);
            } catch (ReasoningServiceException e) {
                log.warn("[Investigation] {} hop {}: reasoning service failed: {}",
                        ctx.getInvestigationId(), hop, e.getMessage());
                ctx.degrade("reasoning service unavailable");
                return forcedFinalize(ctx, record, null, "reasoning service unavailable", attempts, hopStart);
            }
        }

        InvestigationAction requested = decision.getAction();
        record.reasoning(decision.getReasoning()).attempts(attempts);

        if (ctx.isLastHop() && requested.getType() != ActionType.FINALIZE) {
            log.debug("[Investigation] {} hop {}: {} overridden, hop limit reached",
                    ctx.getInvestigationId(), hop, requested.getType());
            ctx.setStopReason("hop limit reached");
            return forcedFinalize(ctx, record, requested, decision.getReasoning(), attempts, hopStart);
        }

        ctx.addEvidence(EvidenceItem.Kind.DECISION, requested.getSignal(), null,
                describe(requested) + ": " + decision.getReasoning());
        ctx.addHop(record.action(requested.getType())
                .target(requested.targetName())
                .durationMs(System.currentTimeMillis() - hopStart)
                .build());
        return requested;
    }

    private void calculateSignal(InvestigationContext ctx, SignalName signal) {
        if (ctx.hasSignal(signal)) {
            ctx.addEvidence(EvidenceItem.Kind.NOTE, signal, null, signal.getWireName() + " already computed");
            return;
        }
        SignalResult result;
        try {
            result = tier2.calculate(signal, ctx.getFilePath());
        } catch (RuntimeException e) {
            log.warn("[Investigation] {} could not compute {}: {}", ctx.getInvestigationId(), signal.getWireName(), e.getMessage());
            result = SignalResult.unknown(signal, ctx.getFilePath(), "computation failed");
        }
        ctx.addSignal(result);
        ctx.addEvidence(EvidenceItem.Kind.SIGNAL, signal, result.getSignalLevel(), result.getEvidenceText());
    }

    private void expandContext(InvestigationContext ctx) {
        ContextGraph context = ctx.getContextGraph();
        if (!context.canExpand()) {
            ctx.addEvidence(EvidenceItem.Kind.NOTE, null, null, "context already expanded, request ignored");
            return;
        }
        try {
            int added = context.expand();
            ctx.addEvidence(EvidenceItem.Kind.CONTEXT, null, null, String.format(
                    "expanded context by %d nodes to depth %d (%d files in context)",
                    added, context.getDepth(), context.files().size()));
        } catch (GraphUnavailableException e) {
            log.warn("[Investigation] {} context expansion failed: {}", ctx.getInvestigationId(), e.getMessage());
            ctx.addEvidence(EvidenceItem.Kind.NOTE, null, null, "context expansion failed, graph unavailable");
        }
    }

    /**
     * Each synthesis attempt is capped by what is left of the budget, so a slow or malformed
     * answer cannot push the investigation past it. The strict retry only runs while budget remains.
     */
    private SynthesisResult synthesize(InvestigationContext ctx) {
        if (ctx.isDegraded()) {
            return degradedSynthesizer.synthesize(ctx.getFilePath(), ctx.getSignals().values(), ctx.getDegradedReason());
        }

        boolean strict = false;
        while (true) {
            long remaining = ctx.remainingBudgetNanos();
            if (remaining <= 0) {
                ctx.markTimedOut("investigation budget exhausted");
                ctx.degrade("investigation budget exhausted before synthesis");
                break;
            }
            Duration timeout = min(properties.getInvestigation().getCallTimeout(), Duration.ofNanos(remaining));
            SynthesisRequest request = SynthesisRequest.builder()
                    .filePath(ctx.getFilePath())
                    .signals(ctx.signalList())
                    .evidenceChain(ctx.evidenceSnapshot())
                    .stopReason(ctx.getStopReason())
                    .strict(strict)
                    .build();
            try {
                SynthesisResult result = withTimeout(() -> reasoningService.synthesize(request), timeout);
                if (ctx.isTimedOut()) {
                    double cap = properties.getInvestigation().getTimeoutConfidenceCap();
                    result.setConfidence(Math.min(result.getConfidence(), cap));
                    result.setReasoningText(result.getReasoningText()
                            + " (Investigation cut short: " + ctx.getStopReason() + "; confidence capped.)");
                }
                if (result.getRecommendations().isEmpty()) {
                    result.setRecommendations(DegradedSynthesizer.recommendations(ctx.getFilePath(),
                            ctx.getSignals().values().stream().filter(SignalResult::isHigh).toList()));
                }
                return result;
            } catch (ReasoningServiceMalformedResponseException e) {
                if (!strict) {
                    log.warn("[Investigation] {} malformed synthesis ({}), retrying with strict format",
                            ctx.getInvestigationId(), e.getMessage());
                    strict = true;
                    continue;
                }
                ctx.degrade("reasoning service returned malformed synthesis");
            } catch (ReasoningServiceTimeoutException e) {
                log.warn("[Investigation] {} synthesis timed out after {}ms", ctx.getInvestigationId(), timeout.toMillis());
                ctx.degrade(ctx.isTimedOut()
                        ? ctx.getStopReason() + " and again during synthesis"
                        : "reasoning service timed out during synthesis");
                ctx.markTimedOut("synthesis timed out");
            } catch (ReasoningServiceUnavailableException e) {
                ctx.degrade("reasoning service unavailable during synthesis");
            } catch (ReasoningServiceException e) {
                ctx.degrade("reasoning service failed during synthesis");
            }
            break;
        }
        log.warn("[Investigation] {} falling back to heuristic synthesis: {}", ctx.getInvestigationId(), ctx.getDegradedReason());
        return degradedSynthesizer.synthesize(ctx.getFilePath(), ctx.getSignals().values(), ctx.getDegradedReason());
    }

    // ---- helpers ----

    private InvestigationAction forcedFinalize(InvestigationContext ctx, HopRecord.HopRecordBuilder record,
                                               InvestigationAction requested, String reasoning,
                                               int attempts, long hopStart) {
        ctx.addEvidence(EvidenceItem.Kind.DECISION, null, null, "FINALIZE (forced): " + reasoning);
        ctx.addHop(record.action(ActionType.FINALIZE)
                .requestedAction(requested != null ? requested.getType() : null)
                .target(requested != null ? requested.targetName() : null)
                .reasoning(reasoning)
                .forced(true)
                .attempts(attempts)
                .durationMs(System.currentTimeMillis() - hopStart)
                .build());
        return InvestigationAction.finalizeInvestigation();
    }

    private DecisionRequest decisionRequest(InvestigationContext ctx, int hop, boolean strict) {
        List<String> available = tier2.available().stream()
                .filter(s -> !ctx.hasSignal(s))
                .map(SignalName::getWireName)
                .toList();
        return DecisionRequest.builder()
                .filePath(ctx.getFilePath())
                .changedFiles(ctx.getChangedFiles())
                .baselineSignals(List.copyOf(ctx.getBaseline().getSignals().values()))
                .evidenceChain(ctx.evidenceSnapshot())
                .availableSignals(available)
                .hop(hop)
                .maxHops(ctx.getMaxHops())
                .contextExpanded(ctx.getContextGraph().isExpanded())
                .contextNodeCount(ctx.getContextGraph().size())
                .strict(strict)
                .build();
    }

    /**
     * Runs a blocking reasoning call on the reasoning pool and gives up after {@code timeout}.
     */
    private <T> T withTimeout(Supplier<T> call, Duration timeout) {
        Callable<T> task = call::get;
        Future<T> future = reasoningExecutor.submit(task);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ReasoningServiceTimeoutException("no answer within " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReasoningServiceTimeoutException("interrupted while waiting for the reasoning service", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReasoningServiceException reasoningFailure) {
                throw reasoningFailure;
            }
            throw new ReasoningServiceUnavailableException("reasoning call failed: " + cause, cause);
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String describe(InvestigationAction action) {
        return action.getType() == ActionType.CALCULATE_SIGNAL
                ? "CALCULATE_SIGNAL " + action.targetName()
                : action.getType().name();
    }

    private RiskAssessment assessment(BaselineResult baseline, Map<String, SignalResult> signals,
                                      List<EvidenceItem> evidence, SynthesisResult synthesis,
                                      boolean investigated, boolean degraded, String investigationId) {
        return RiskAssessment.builder()
                .filePath(baseline.getFilePath())
                .riskLevel(synthesis.getRiskLevel())
                .confidence(synthesis.getConfidence())
                .escalated(true)
                .investigated(investigated)
                .degraded(degraded)
                .signals(new LinkedHashMap<>(signals))
                .disabledSignals(baseline.getDisabledSignals())
                .riskProfile(baseline.getRiskProfile())
                .profileReason(baseline.getProfileReason())
                .evidenceChain(evidence)
                .keyEvidence(synthesis.getKeyEvidence())
                .recommendations(synthesis.getRecommendations())
                .reasoningText(synthesis.getReasoningText())
                .investigationId(investigationId)
                .build();
    }
}
