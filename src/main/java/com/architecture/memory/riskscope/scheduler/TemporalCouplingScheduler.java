package com.architecture.memory.riskscope.scheduler;

import com.architecture.memory.riskscope.dto.ingest.CoChangeUpdateResult;
import com.architecture.memory.riskscope.service.graph.GraphUnavailableException;
import com.architecture.memory.riskscope.service.temporal.TemporalCouplingBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic incremental CO_CHANGED refresh for files changed since the previous run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TemporalCouplingScheduler {

    private final TemporalCouplingBuilder temporalCouplingBuilder;

    @Scheduled(fixedDelayString = "${riskscope.temporal.refresh-interval:PT15M}",
            initialDelayString = "${riskscope.temporal.refresh-interval:PT15M}")
    public void refreshCoChangeEdges() {
        log.debug("[Temporal] Running scheduled co-change refresh...");
        try {
            CoChangeUpdateResult result = temporalCouplingBuilder.runIncremental();
            if (result.getMode() != CoChangeUpdateResult.Mode.SKIPPED) {
                log.info("[Temporal] Scheduled refresh rewrote edges for {} files", result.getAffectedFiles().size());
            }
        } catch (GraphUnavailableException e) {
            log.warn("[Temporal] Scheduled refresh skipped, graph unavailable: {}", e.getMessage());
        } catch (Exception e) {
            log.error("[Temporal] Scheduled refresh failed: {}", e.getMessage(), e);
        }
    }
}
