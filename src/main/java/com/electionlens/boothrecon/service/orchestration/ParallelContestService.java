package com.electionlens.boothrecon.service.orchestration;

import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.ContestOutcome;
import com.electionlens.boothrecon.exception.BoothReconException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Processes many contests concurrently, one task per contest, on the bounded contest executor.
 *
 * <p>Contests share nothing mutable (the roster of each is read-only), so no synchronization is
 * needed beyond waiting for all tasks. Results come back in input order.
 */
@Service
public class ParallelContestService {

    private static final Logger LOG = LogManager.getLogger(ParallelContestService.class);

    private final ContestPipeline pipeline;
    private final Executor contestExecutor;

    public ParallelContestService(ContestPipeline pipeline,
                                  @Qualifier("contestExecutor") Executor contestExecutor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.contestExecutor = Objects.requireNonNull(contestExecutor, "contestExecutor");
    }

    /**
     * @param inputs contests to process
     * @return one outcome per input, in the same order
     * @throws BoothReconException if a contest fails with an unexpected error
     */
    public List<ContestOutcome> processAll(List<ContestInput> inputs) {
        Objects.requireNonNull(inputs, "inputs");
        if (inputs.isEmpty()) {
            return List.of();
        }
        long startMs = System.currentTimeMillis();
        LOG.info("Processing {} contests in parallel", inputs.size());

        List<CompletableFuture<ContestOutcome>> futures = new ArrayList<>(inputs.size());
        for (ContestInput input : inputs) {
            futures.add(CompletableFuture.supplyAsync(() -> pipeline.process(input), contestExecutor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            List<ContestOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
            long reconciled = outcomes.stream().filter(ContestOutcome::isReconciled).count();
            LOG.info("Batch completed: {} reconciled, {} failed, duration={}ms",
                    reconciled, outcomes.size() - reconciled, System.currentTimeMillis() - startMs);
            return outcomes;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.error("Batch processing failed after {}ms: {}", System.currentTimeMillis() - startMs,
                    cause.getMessage());
            if (cause instanceof BoothReconException bre) {
                throw bre;
            }
            throw new BoothReconException("Batch processing failed: " + cause.getMessage(), cause);
        }
    }
}
