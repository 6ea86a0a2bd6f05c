package com.architecture.memory.riskscope.controller;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.RiskCheckReport;
import com.architecture.memory.riskscope.dto.risk.RiskLevel;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.service.CancellationSignal;
import com.architecture.memory.riskscope.service.RiskCheckService;
import com.architecture.memory.riskscope.service.agent.InvestigationAgent;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import com.architecture.memory.riskscope.service.validation.FeedbackDispatcher;
import com.architecture.memory.riskscope.service.validation.SignalValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RiskApiControllerTest {

    @Mock
    private RiskCheckService riskCheckService;

    @Mock
    private InvestigationAgent investigationAgent;

    @Mock
    private FeedbackDispatcher feedbackDispatcher;

    @Mock
    private SignalValidator signalValidator;

    private RiskCheckController riskCheckController;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        riskCheckController = new RiskCheckController(riskCheckService, investigationAgent,
                new SimpleAsyncTaskExecutor("check-"), new RiskScopeProperties());
        mockMvc = MockMvcBuilders
                .standaloneSetup(riskCheckController,
                        new FeedbackController(feedbackDispatcher, signalValidator))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void check_returnsReport() throws Exception {
        when(riskCheckService.check(anyList(), any(CancellationSignal.class))).thenReturn(RiskCheckReport.builder()
                .checkId("c-1").overallRiskLevel(RiskLevel.HIGH).build());

        MvcResult pending = mockMvc.perform(post("/api/risk/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"changedFiles\": [\"a.go\"]}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallRiskLevel").value("HIGH"));
    }

    @Test
    void checkTimeout_cancelsTheRunningCheck() {
        CancellationSignal cancellation = new CancellationSignal();

        assertThatThrownBy(() -> riskCheckController.timedOut(cancellation, List.of("a.go"), Duration.ofSeconds(60)))
                .isInstanceOf(RiskCheckTimeoutException.class)
                .hasMessageContaining("60000ms");
        assertThat(cancellation.isCancelled()).isTrue();
    }

    @Test
    void checkTimeout_mapsTo503() {
        assertThat(new RestExceptionHandler().handleCheckTimeout(new RiskCheckTimeoutException(Duration.ofSeconds(1))))
                .satisfies(response -> {
                    assertThat(response.getStatusCode().value()).isEqualTo(503);
                    assertThat(response.getBody()).containsEntry("error", "check_timed_out");
                });
    }

    @Test
    void check_rejectsEmptyFileList() throws Exception {
        mockMvc.perform(post("/api/risk/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"changedFiles\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_failed"));
        verifyNoInteractions(riskCheckService);
    }

    @Test
    void check_mapsGraphOutageTo503() throws Exception {
        when(riskCheckService.check(anyList(), any(CancellationSignal.class)))
                .thenThrow(new GraphUnavailableException("neo4j down"));

        MvcResult pending = mockMvc.perform(post("/api/risk/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"changedFiles\": [\"a.go\"]}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("graph_unavailable"));
    }

    @Test
    void unknownInvestigation_is404() throws Exception {
        when(investigationAgent.findTrace("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/risk/investigations/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void feedback_isAcceptedAndDispatched() throws Exception {
        mockMvc.perform(post("/api/risk/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"signalName\": \"coupling\", \"falsePositive\": true, \"filePath\": \"a.go\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.signal").value("coupling"));

        verify(feedbackDispatcher).submit(SignalName.COUPLING, true, null, "a.go");
    }

    @Test
    void feedback_rejectsUnknownSignal() throws Exception {
        mockMvc.perform(post("/api/risk/feedback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"signalName\": \"vibes\", \"falsePositive\": false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown signal: vibes"));
        verifyNoInteractions(feedbackDispatcher);
    }

    @Test
    void signals_listsValidatorState() throws Exception {
        when(signalValidator.stats()).thenReturn(List.of());

        mockMvc.perform(get("/api/risk/signals"))
                .andExpect(status().isOk());
    }
}
