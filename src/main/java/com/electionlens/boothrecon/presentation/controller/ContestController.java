package com.electionlens.boothrecon.presentation.controller;

import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.ContestOutcome;
import com.electionlens.boothrecon.presentation.dto.ContestResponse;
import com.electionlens.boothrecon.presentation.dto.ReconcileBatchRequest;
import com.electionlens.boothrecon.presentation.dto.ReconcileContestRequest;
import com.electionlens.boothrecon.service.orchestration.ContestPipeline;
import com.electionlens.boothrecon.service.orchestration.ParallelContestService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST entry point for contest reconciliation. A FAILED contest is a normal outcome and is
 * returned with 200; only malformed requests produce error statuses.
 */
@RestController
@RequestMapping("/api/contests")
class ContestController {

    private static final Logger LOG = LogManager.getLogger(ContestController.class);

    private final ContestPipeline pipeline;
    private final ParallelContestService parallelService;
    private final ContestRequestMapper requestMapper;

    ContestController(ContestPipeline pipeline, ParallelContestService parallelService,
                      ContestRequestMapper requestMapper) {
        this.pipeline = pipeline;
        this.parallelService = parallelService;
        this.requestMapper = requestMapper;
    }

    @PostMapping("/reconcile")
    ResponseEntity<ContestResponse> reconcile(@Valid @RequestBody ReconcileContestRequest request) {
        LOG.info("Reconcile request: contestId={}, lines={}, candidates={}",
                request.contestId(), request.lines().size(), request.candidates().size());
        ContestOutcome outcome = pipeline.process(requestMapper.toInput(request));
        return ResponseEntity.ok(ContestResponse.from(outcome));
    }

    @PostMapping("/reconcile-batch")
    ResponseEntity<List<ContestResponse>> reconcileBatch(@Valid @RequestBody ReconcileBatchRequest request) {
        LOG.info("Batch reconcile request: contests={}", request.contests().size());
        List<ContestInput> inputs = request.contests().stream().map(requestMapper::toInput).toList();
        List<ContestResponse> responses = parallelService.processAll(inputs).stream()
                .map(ContestResponse::from)
                .toList();
        return ResponseEntity.ok(responses);
    }
}
