package com.architecture.memory.riskscope.controller;

import com.architecture.memory.riskscope.dto.ingest.CoChangeUpdateResult;
import com.architecture.memory.riskscope.dto.ingest.CommitIngestedRequest;
import com.architecture.memory.riskscope.dto.ingest.IncidentLinkRequest;
import com.architecture.memory.riskscope.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Hooks called by the ingestion pipeline after it writes to the graph.
 */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping("/commits")
    public ResponseEntity<CoChangeUpdateResult> commitIngested(@Valid @RequestBody CommitIngestedRequest request) {
        return ResponseEntity.ok(ingestionService.onCommitIngested(request));
    }

    @PostMapping("/incident-links")
    public ResponseEntity<Map<String, Object>> incidentLinked(@Valid @RequestBody IncidentLinkRequest request) {
        int indexed = ingestionService.onIncidentLinked(request);
        return ResponseEntity.ok(Map.of("incidentId", request.getIncidentId(), "indexedIncidents", indexed));
    }

    @PostMapping("/co-change/rebuild")
    public ResponseEntity<CoChangeUpdateResult> rebuildCoChange() {
        log.info("Full co-change rebuild requested");
        return ResponseEntity.ok(ingestionService.rebuildCoChange());
    }
}
