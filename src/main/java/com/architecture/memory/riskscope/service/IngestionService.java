package com.architecture.memory.riskscope.service;

import com.architecture.memory.riskscope.dto.ingest.CoChangeUpdateResult;
import com.architecture.memory.riskscope.dto.ingest.CommitIngestedRequest;
import com.architecture.memory.riskscope.dto.ingest.IncidentLinkRequest;
import com.architecture.memory.riskscope.service.cache.CacheInvalidationService;
import com.architecture.memory.riskscope.service.search.IncidentSearchIndex;
import com.architecture.memory.riskscope.service.temporal.TemporalCouplingBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reacts to graph updates made by the ingestion pipeline: drops stale cache entries and keeps
 * derived data (CO_CHANGED edges, incident index) current.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final CacheInvalidationService cacheInvalidation;
    private final TemporalCouplingBuilder temporalCouplingBuilder;
    private final IncidentSearchIndex incidentSearchIndex;

    public CoChangeUpdateResult onCommitIngested(CommitIngestedRequest request) {
        List<String> files = request.getFiles().stream().map(String::trim).distinct().toList();
        log.info("[Ingest] Commit {} touched {} files", request.getSha(), files.size());
        cacheInvalidation.onCommit(files);
        return temporalCouplingBuilder.updateForFiles(files);
    }

    public int onIncidentLinked(IncidentLinkRequest request) {
        log.info("[Ingest] Incident {} linked to {} files", request.getIncidentId(), request.getFilePaths().size());
        cacheInvalidation.onIncidentLinked(request.getFilePaths());
        incidentSearchIndex.rebuild();
        return incidentSearchIndex.size();
    }

    public CoChangeUpdateResult rebuildCoChange() {
        return temporalCouplingBuilder.rebuildWindow();
    }
}
