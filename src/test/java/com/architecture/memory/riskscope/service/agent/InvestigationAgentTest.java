package com.architecture.memory.riskscope.service.agent;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.graph.GraphNodeRef;
import com.architecture.memory.riskscope.dto.reasoning.ActionType;
import com.architecture.memory.riskscope.dto.reasoning.DecisionRequest;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationAction;
import com.architecture.memory.riskscope.dto.reasoning.InvestigationDecision;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisRequest;
import com.architecture.memory.riskscope.dto.reasoning.SynthesisResult;
import com.architecture.memory.riskscope.dto.risk.BaselineResult;
import com.architecture.memory.riskscope.dto.risk.HopRecord;
import com.architecture.memory.riskscope.dto.risk.InvestigationTrace;
import com.architecture.memory.riskscope.dto.risk.RiskAssessment;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.dto.risk.SignalResult;
import com.architecture.memory.riskscope.dto.risk.SignalStatus;
import com.architecture.memory.riskscope.service.CancellationSignal;
import com.architecture.memory.riskscope.service.cache.CaffeineSignalCache;
import com.architecture.memory.riskscope.service.graph.GraphStoreAdapter;
import com.architecture.memory.riskscope.service.reasoning.ReasoningService;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceMalformedResponseException;
import com.architecture.memory.riskscope.service.reasoning.ReasoningServiceUnavailableException;
import com.architecture.memory.riskscope.service.signal.Tier2SignalCalculator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvestigationAgentTest {

    private static final String FILE = "services/payments/charge.go";

    @Mock
    private GraphStoreAdapter graph;

    @Mock
    private ReasoningService reasoningService;

    @Mock
    private Tier2SignalCalculator tier2;

    private RiskScopeProperties properties;
    private ExecutorService reasoningExecutor;
    private CaffeineSignalCache cache;
    private InvestigationAgent agent;

    @BeforeEach
    void setUp() {
        properties = new RiskScopeProperties();
        properties.getInvestigation().setCallTimeout(Duration.ofMillis(150));
        properties.getInvestigation().setBudget(Duration.ofSeconds(5));
        reasoningExecutor = Executors.newCachedThreadPool();
        cache = new CaffeineSignalCache(100);
        agent = new InvestigationAgent(graph, reasoningService, tier2, new DegradedSynthesizer(), cache,
                reasoningExecutor, properties, Clock.fixed(Instant.parse("2026-05-01T08:00:00Z"), ZoneOffset.UTC));

        lenient().when(reasoningService.isAvailable()).thenReturn(true);
        lenient().when(graph.neighbors(any(GraphNodeRef.class), eq(1))).thenReturn(Set.of(
                GraphNodeRef.builder().id("services/payments/refund.go").label("File").build()));
        lenient().when(tier2.available()).thenReturn(List.of(SignalName.OWNERSHIP_CHURN, SignalName.INCIDENT_SIMILARITY));
        lenient().when(tier2.calculate(eq(SignalName.OWNERSHIP_CHURN), anyString())).thenReturn(
                computed(SignalName.OWNERSHIP_CHURN, 12.0, RiskLevel.HIGH));
        lenient().when(tier2.calculate(eq(SignalName.INCIDENT_SIMILARITY), anyString())).thenReturn(
                computed(SignalName.INCIDENT_SIMILARITY, 2.0, RiskLevel.LOW));
    }

    @AfterEach
    void tearDown() {
        reasoningExecutor.shutdownNow();
    }

    @Test
    void computesRequestedSignal_thenSynthesizes() {
        when(reasoningService.decide(any()))
                .thenReturn(decision(InvestigationAction.calculateSignal(SignalName.OWNERSHIP_CHURN)))
                .thenReturn(decision(InvestigationAction.finalizeInvestigation()));
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.8));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(assessment.getConfidence()).isEqualTo(0.8);
        assertThat(assessment.isInvestigated()).isTrue();
        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.getSignals()).containsKeys("co_change", "ownership_churn");
        assertThat(assessment.getEvidenceChain()).extracting(e -> e.getSequence())
                .isSorted()
                .doesNotHaveDuplicates();

        ArgumentCaptor<SynthesisRequest> captor = ArgumentCaptor.forClass(SynthesisRequest.class);
        verify(reasoningService).synthesize(captor.capture());
        assertThat(captor.getValue().getSignals()).extracting(SignalResult::getName)
                .contains(SignalName.OWNERSHIP_CHURN);

        InvestigationTrace trace = agent.findTrace(assessment.getInvestigationId()).orElseThrow();
        assertThat(trace.getHops()).extracting(HopRecord::getAction)
                .containsExactly(ActionType.CALCULATE_SIGNAL, ActionType.FINALIZE);
        assertThat(trace.getStopReason()).isEqualTo("reasoning service finalized");
    }

    @Test
    void neverExceedsThreeHops_andForcesFinalizeAtTheLast() {
        when(reasoningService.decide(any()))
                .thenReturn(decision(InvestigationAction.calculateSignal(SignalName.OWNERSHIP_CHURN)))
                .thenReturn(decision(InvestigationAction.calculateSignal(SignalName.INCIDENT_SIMILARITY)))
                .thenReturn(decision(InvestigationAction.calculateSignal(SignalName.OWNERSHIP_CHURN)));
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.MEDIUM, 0.7));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        verify(reasoningService, times(3)).decide(any());
        InvestigationTrace trace = agent.findTrace(assessment.getInvestigationId()).orElseThrow();
        assertThat(trace.getHops()).hasSize(3);
        HopRecord last = trace.getHops().get(2);
        assertThat(last.getAction()).isEqualTo(ActionType.FINALIZE);
        assertThat(last.isForced()).isTrue();
        assertThat(last.getRequestedAction()).isEqualTo(ActionType.CALCULATE_SIGNAL);
        assertThat(trace.getStopReason()).isEqualTo("hop limit reached");
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void retriesMalformedDecisionOnceWithStrictFormat() {
        when(reasoningService.decide(any()))
                .thenThrow(new ReasoningServiceMalformedResponseException("not json", "HIGH!"))
                .thenReturn(decision(InvestigationAction.finalizeInvestigation()));
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.75));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        ArgumentCaptor<DecisionRequest> captor = ArgumentCaptor.forClass(DecisionRequest.class);
        verify(reasoningService, times(2)).decide(captor.capture());
        assertThat(captor.getAllValues()).extracting(DecisionRequest::isStrict).containsExactly(false, true);
        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.getConfidence()).isEqualTo(0.75);
    }

    @Test
    void degradesAfterSecondMalformedDecision() {
        when(reasoningService.decide(any()))
                .thenThrow(new ReasoningServiceMalformedResponseException("not json", "?"));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        verify(reasoningService, times(2)).decide(any());
        verify(reasoningService, never()).synthesize(any());
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getConfidence()).isZero();
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessment.getReasoningText()).contains("malformed");
    }

    @Test
    void everyCallTimingOut_yieldsHeuristicWithZeroConfidence() {
        when(reasoningService.decide(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return decision(InvestigationAction.finalizeInvestigation());
        });
        when(reasoningService.synthesize(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return synthesis(RiskLevel.LOW, 0.9);
        });

        long start = System.currentTimeMillis();
        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        assertThat(System.currentTimeMillis() - start).isLessThan(1_500);
        assertThat(assessment.getConfidence()).isZero();
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getReasoningText()).contains("timed out");
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void decisionTimeout_capsSynthesisConfidence() {
        when(reasoningService.decide(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return decision(InvestigationAction.finalizeInvestigation());
        });
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.9));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        assertThat(assessment.getConfidence()).isEqualTo(0.3);
        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.getReasoningText()).contains("confidence capped");
    }

    @Test
    void slowDecisionAndSynthesis_stayWithinInvestigationBudget() {
        properties.getInvestigation().setCallTimeout(Duration.ofSeconds(4));
        properties.getInvestigation().setBudget(Duration.ofMillis(500));
        properties.getInvestigation().setSynthesisReserve(Duration.ofMillis(200));
        when(reasoningService.decide(any())).thenAnswer(inv -> {
            Thread.sleep(450);
            return decision(InvestigationAction.finalizeInvestigation());
        });
        when(reasoningService.synthesize(any())).thenAnswer(inv -> {
            Thread.sleep(1_400);
            return synthesis(RiskLevel.HIGH, 0.9);
        });

        long start = System.currentTimeMillis();
        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());
        long elapsed = System.currentTimeMillis() - start;

        assertThat(elapsed).isLessThan(900);
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getConfidence()).isZero();
        InvestigationTrace trace = agent.findTrace(assessment.getInvestigationId()).orElseThrow();
        assertThat(trace.getHops()).hasSize(1);
        assertThat(trace.getHops().get(0).isForced()).isTrue();
        assertThat(trace.getStopReason()).contains("timed out");
    }

    @Test
    void strictSynthesisRetry_isCappedByRemainingBudget() {
        properties.getInvestigation().setCallTimeout(Duration.ofSeconds(4));
        properties.getInvestigation().setBudget(Duration.ofMillis(600));
        properties.getInvestigation().setSynthesisReserve(Duration.ofMillis(400));
        when(reasoningService.decide(any())).thenReturn(decision(InvestigationAction.finalizeInvestigation()));
        when(reasoningService.synthesize(any()))
                .thenThrow(new ReasoningServiceMalformedResponseException("not json", "?"))
                .thenAnswer(inv -> {
                    Thread.sleep(2_000);
                    return synthesis(RiskLevel.LOW, 0.9);
                });

        long start = System.currentTimeMillis();
        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        assertThat(System.currentTimeMillis() - start).isLessThan(1_000);
        verify(reasoningService, times(2)).synthesize(any());
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.getConfidence()).isZero();
    }

    @Test
    void exhaustedDecisionWindow_finalizesWithoutAskingForDecisions() {
        properties.getInvestigation().setBudget(Duration.ofSeconds(1));
        properties.getInvestigation().setSynthesisReserve(Duration.ofSeconds(1));
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.9));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        verify(reasoningService, never()).decide(any());
        assertThat(assessment.isDegraded()).isFalse();
        assertThat(assessment.getConfidence()).isEqualTo(0.3);
        assertThat(assessment.getReasoningText()).contains("investigation budget exhausted");
    }

    @Test
    void expandsContextAtMostOnce() {
        when(reasoningService.decide(any()))
                .thenReturn(decision(InvestigationAction.expandContext()))
                .thenReturn(decision(InvestigationAction.expandContext()))
                .thenReturn(decision(InvestigationAction.finalizeInvestigation()));
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.6));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        InvestigationTrace trace = agent.findTrace(assessment.getInvestigationId()).orElseThrow();
        assertThat(trace.isContextExpanded()).isTrue();
        assertThat(assessment.getEvidenceChain())
                .anyMatch(e -> e.getDescription().contains("already expanded"));
        // one call for the root, one for its single neighbor
        verify(graph, times(2)).neighbors(any(GraphNodeRef.class), eq(1));
    }

    @Test
    void fallsBackToHeuristic_whenReasoningServiceUnavailable() {
        when(reasoningService.isAvailable()).thenReturn(false);

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        verify(reasoningService, never()).decide(any());
        assertThat(assessment.isDegraded()).isTrue();
        assertThat(assessment.isEscalated()).isTrue();
        assertThat(assessment.getConfidence()).isZero();
        assertThat(assessment.getInvestigationId()).isNull();
        assertThat(assessment.getReasoningText()).contains("reasoning service unavailable");
    }

    @Test
    void serviceFailureMidInvestigation_degrades() {
        when(reasoningService.decide(any()))
                .thenReturn(decision(InvestigationAction.calculateSignal(SignalName.OWNERSHIP_CHURN)))
                .thenThrow(new ReasoningServiceUnavailableException("503"));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), CancellationSignal.none());

        assertThat(assessment.isDegraded()).isTrue();
        // co_change and ownership_churn are both HIGH
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(assessment.getConfidence()).isZero();
    }

    @Test
    void cancelledCheck_stopsBeforeAskingForDecisions() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();
        when(reasoningService.synthesize(any())).thenReturn(synthesis(RiskLevel.HIGH, 0.5));

        RiskAssessment assessment = agent.investigate(baseline(), List.of(FILE), cancellation);

        verify(reasoningService, never()).decide(any());
        InvestigationTrace trace = agent.findTrace(assessment.getInvestigationId()).orElseThrow();
        assertThat(trace.getStopReason()).isEqualTo("cancelled");
    }

    private static BaselineResult baseline() {
        Map<String, SignalResult> signals = new LinkedHashMap<>();
        signals.put("coupling", computed(SignalName.COUPLING, 4.0, RiskLevel.LOW));
        signals.put("co_change", computed(SignalName.CO_CHANGE, 0.85, RiskLevel.HIGH));
        signals.put("test_ratio", computed(SignalName.TEST_RATIO, 1.2, RiskLevel.LOW));
        return BaselineResult.builder()
                .filePath(FILE)
                .riskLevel(RiskLevel.HIGH)
                .escalate(true)
                .signals(signals)
                .build();
    }

    private static SignalResult computed(SignalName name, double value, RiskLevel level) {
        return SignalResult.builder()
                .name(name)
                .filePath(FILE)
                .status(SignalStatus.COMPUTED)
                .value(value)
                .signalLevel(level)
                .evidenceText(name.getWireName() + "=" + value)
                .build();
    }

    private static InvestigationDecision decision(InvestigationAction action) {
        return InvestigationDecision.builder().action(action).reasoning("because").build();
    }

    private static SynthesisResult synthesis(RiskLevel level, double confidence) {
        return SynthesisResult.builder()
                .riskLevel(level)
                .confidence(confidence)
                .keyEvidence(List.of("co_change=0.85"))
                .recommendations(List.of("review refund.go"))
                .reasoningText("assessed")
                .build();
    }
}
