package com.electionlens.boothrecon.service.metrics;

import com.electionlens.boothrecon.domain.ContestOutcome;
import com.electionlens.boothrecon.domain.SkipReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for contest processing.
 *
 * <p>Provides:
 * <ul>
 *   <li>Outcomes by final state and failure kind</li>
 *   <li>Accepted mapping strategy counts</li>
 *   <li>Skipped source lines by reason</li>
 *   <li>Per-contest processing time</li>
 * </ul>
 */
@Component
public class ReconciliationMetrics {

    static final String METRIC_PREFIX = "boothrecon.contest";

    private final MeterRegistry registry;

    public ReconciliationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a finished contest, and its accepted strategy when reconciled.
     */
    public void recordOutcome(ContestOutcome outcome) {
        String kind = outcome.failureKind() == null ? "none" : outcome.failureKind().name().toLowerCase(Locale.ROOT);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of contests by final state")
                .tag("state", outcome.state().name().toLowerCase(Locale.ROOT))
                .tag("failure", kind)
                .register(registry)
                .increment();
        if (outcome.isReconciled() && outcome.mapping() != null) {
            recordAcceptedStrategy(outcome.mapping().strategy());
        }
    }

    public void recordAcceptedStrategy(String strategy) {
        Counter.builder(METRIC_PREFIX + ".mapping.accepted")
                .description("Number of contests reconciled per mapping strategy")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the lines were skipped
     * @param count  how many lines; ignored when zero
     */
    public void recordSkippedLines(SkipReason reason, long count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".lines.skipped")
                .description("Number of source lines that did not become booth rows")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment(count);
    }

    public void recordDuration(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Time taken to process one contest")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
