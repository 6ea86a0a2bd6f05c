package com.architecture.memory.riskscope.controller;

import com.architecture.memory.riskscope.config.RiskScopeProperties;
import com.architecture.memory.riskscope.dto.risk.InvestigationTrace;
import com.architecture.memory.riskscope.dto.risk.RiskCheckReport;
import com.architecture.memory.riskscope.dto.risk.RiskCheckRequest;
import com.architecture.memory.riskscope.service.CancellationSignal;
import com.architecture.memory.riskscope.service.RiskCheckService;
import com.architecture.memory.riskscope.service.agent.InvestigationAgent;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.WebAsyncTask;

import java.time.Duration;
import java.util.List;

/**
 * Risk checks over a changed-file set, and the traces of the investigations they ran.
 *
 * <p>Checks run off the request thread. When the async request times out, the check's
 * {@link CancellationSignal} is cancelled so its signal tasks and investigations stop.</p>
 */
@RestController
@RequestMapping("/api/risk")
@Slf4j
public class RiskCheckController {

    private final RiskCheckService riskCheckService;
    private final InvestigationAgent investigationAgent;
    private final AsyncTaskExecutor checkExecutor;
    private final RiskScopeProperties properties;

    public RiskCheckController(RiskCheckService riskCheckService,
                               InvestigationAgent investigationAgent,
                               @Qualifier("taskExecutor") AsyncTaskExecutor checkExecutor,
                               RiskScopeProperties properties) {
        this.riskCheckService = riskCheckService;
        this.investigationAgent = investigationAgent;
        this.checkExecutor = checkExecutor;
        this.properties = properties;
    }

    @PostMapping("/check")
    public WebAsyncTask<ResponseEntity<RiskCheckReport>> check(@Valid @RequestBody RiskCheckRequest request) {
        List<String> changedFiles = request.getChangedFiles();
        Duration timeout = properties.getApi().getCheckTimeout();
        log.info("Received risk check for {} files", changedFiles.size());

        CancellationSignal cancellation = new CancellationSignal();
        WebAsyncTask<ResponseEntity<RiskCheckReport>> task = new WebAsyncTask<>(timeout.toMillis(), checkExecutor,
                () -> ResponseEntity.ok(riskCheckService.check(changedFiles, cancellation)));
        task.onTimeout(() -> timedOut(cancellation, changedFiles, timeout));
        return task;
    }

    /**
     * Trace of a past investigation. Traces live only in the ephemeral cache, so this is 404
     * once the trace TTL has passed.
     */
    @GetMapping("/investigations/{id}")
    public ResponseEntity<InvestigationTrace> investigation(@PathVariable String id) {
        return investigationAgent.findTrace(id)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new InvestigationNotFoundException(id));
    }

    ResponseEntity<RiskCheckReport> timedOut(CancellationSignal cancellation, List<String> changedFiles,
                                             Duration timeout) {
        cancellation.cancel();
        log.warn("Risk check for {} files timed out after {}ms, cancelled", changedFiles.size(), timeout.toMillis());
        throw new RiskCheckTimeoutException(timeout);
    }
}
