package com.architecture.memory.riskscope.controller;

import com.architecture.memory.riskscope.dto.risk.FeedbackRequest;
import com.architecture.memory.riskscope.dto.risk.SignalName;
import com.architecture.memory.riskscope.model.SignalStat;
import com.architecture.memory.riskscope.service.validation.FeedbackDispatcher;
import com.architecture.memory.riskscope.service.validation.SignalValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Signal feedback and validation state.
 */
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Slf4j
public class FeedbackController {

    private final FeedbackDispatcher feedbackDispatcher;
    private final SignalValidator signalValidator;

    /**
     * Accepts a true/false-positive verdict. Processed asynchronously; the response only
     * acknowledges receipt.
     */
    @PostMapping("/feedback")
    public ResponseEntity<Map<String, String>> feedback(@Valid @RequestBody FeedbackRequest request) {
        SignalName signal = resolve(request.getSignalName());
        feedbackDispatcher.submit(signal, request.getFalsePositive(), request.getReason(), request.getFilePath());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "accepted", "signal", signal.getWireName()));
    }

    @GetMapping("/signals")
    public ResponseEntity<List<SignalStat>> signals() {
        return ResponseEntity.ok(signalValidator.stats());
    }

    @PostMapping("/signals/{name}/enable")
    public ResponseEntity<SignalStat> enable(@PathVariable String name) {
        log.info("Manual re-enable requested for signal {}", name);
        return ResponseEntity.ok(signalValidator.enable(resolve(name)));
    }

    private static SignalName resolve(String name) {
        return SignalName.fromWireName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown signal: " + name));
    }
}
