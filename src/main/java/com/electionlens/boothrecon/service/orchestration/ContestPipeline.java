package com.electionlens.boothrecon.service.orchestration;

import com.electionlens.boothrecon.domain.BoothId;
import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.ContestOutcome;
import com.electionlens.boothrecon.domain.ContestState;
import com.electionlens.boothrecon.domain.FailureKind;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.domain.SkipReason;
import com.electionlens.boothrecon.domain.SkippedLine;
import com.electionlens.boothrecon.domain.ValidationReport;
import com.electionlens.boothrecon.exception.MappingFailedException;
import com.electionlens.boothrecon.exception.ReconciliationImpossibleException;
import com.electionlens.boothrecon.service.extract.LineExtraction;
import com.electionlens.boothrecon.service.extract.RowExtractor;
import com.electionlens.boothrecon.service.mapping.ColumnMapper;
import com.electionlens.boothrecon.service.mapping.MappingSelection;
import com.electionlens.boothrecon.service.metrics.ReconciliationMetrics;
import com.electionlens.boothrecon.service.orchestration.event.ContestFailedEvent;
import com.electionlens.boothrecon.service.orchestration.event.ContestReconciledEvent;
import com.electionlens.boothrecon.service.reconcile.BoothReconciler;
import com.electionlens.boothrecon.service.reconcile.Reconciliation;
import com.electionlens.boothrecon.service.validation.BoothRecordValidator;
import com.electionlens.boothrecon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one contest through extraction, mapping, validation and reconciliation.
 *
 * <p>Flow:
 * <ol>
 *   <li>Extract every line; skipped lines and repeated booths go to the skip ledger</li>
 *   <li>Try mapping strategies, validating each candidate mapping, until one passes or the
 *       retry budget runs out</li>
 *   <li>Reconcile the accepted records against the official totals</li>
 *   <li>Publish a {@link ContestReconciledEvent} or {@link ContestFailedEvent} and record metrics</li>
 * </ol>
 *
 * <p>Domain failures never escape {@link #process}: they become a FAILED outcome with a
 * {@link FailureKind}. Configuration errors (unknown strategy name) and programming errors do
 * propagate.
 *
 * <p>Thread-safe: holds no per-contest state, so contests may run concurrently.
 */
@Service
public class ContestPipeline {

    private static final Logger LOG = LogManager.getLogger(ContestPipeline.class);

    static final String MDC_CONTEST_ID = "contestId";

    private final RowExtractor extractor;
    private final ColumnMapper mapper;
    private final BoothRecordValidator validator;
    private final BoothReconciler reconciler;
    private final ApplicationEventPublisher publisher;
    private final ReconciliationMetrics metrics;

    public ContestPipeline(RowExtractor extractor,
                           ColumnMapper mapper,
                           BoothRecordValidator validator,
                           BoothReconciler reconciler,
                           ApplicationEventPublisher publisher,
                           ReconciliationMetrics metrics) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Processes one contest to a terminal outcome.
     *
     * @param input lines, roster and configuration of the contest
     * @return RECONCILED outcome with records, or FAILED outcome with issues
     */
    public ContestOutcome process(ContestInput input) {
        Objects.requireNonNull(input, "input");
        long startNanos = System.nanoTime();
        ThreadContext.put(MDC_CONTEST_ID, input.contestId());
        try {
            ContestOutcome outcome = run(input);
            publish(outcome);
            metrics.recordOutcome(outcome);
            recordSkips(outcome.skippedLines());
            return outcome;
        } finally {
            metrics.recordDuration(System.nanoTime() - startNanos);
            ThreadContext.remove(MDC_CONTEST_ID);
        }
    }

    private ContestOutcome run(ContestInput input) {
        String contestId = input.contestId();
        ContestStateMachine machine = new ContestStateMachine(contestId);

        List<SkippedLine> skipped = new ArrayList<>();
        List<RawBoothRow> rows = extractRows(input, skipped);
        LOG.info("Extracted {} booth rows from {} lines ({} skipped)",
                rows.size(), input.lines().size(), skipped.size());

        if (rows.isEmpty()) {
            machine.transition(ContestState.FAILED);
            LOG.warn("Contest failed: no booth rows could be extracted");
            return ContestOutcome.failed(contestId, FailureKind.NO_DATA, null,
                    List.of("no booth rows extracted from " + input.lines().size() + " lines"),
                    List.of(), List.of(), skipped);
        }

        MappingSelection selection;
        try {
            selection = mapper.infer(contestId, rows, input.roster(), input.config(), mapping -> {
                machine.transition(ContestState.MAPPED);
                ValidationReport report = validator.validate(mapping.applyAll(rows), input.roster(), input.config());
                machine.transition(report.passed() ? ContestState.VALIDATED : ContestState.EXTRACTED);
                return report;
            });
        } catch (MappingFailedException e) {
            machine.transition(ContestState.FAILED);
            ValidationReport best = e.getBestReport();
            LOG.warn("Contest failed: no mapping passed validation after {} attempt(s); best was {} with {} issue(s)",
                    e.getAttempts().size(), e.getBestAttempt().strategy(), best.issues().size());
            return ContestOutcome.failed(contestId, FailureKind.MAPPING, e.getBestMapping(),
                    best.issues(), best.warnings(), e.getAttempts(), skipped);
        }

        List<String> warnings = selection.report().warnings();
        for (String warning : warnings) {
            LOG.warn("Audit warning: {}", warning);
        }

        List<BoothRecord> records = selection.mapping().applyAll(rows);
        try {
            Reconciliation reconciliation = reconciler.reconcile(records, input.roster(), input.declaredOutOfBooth());
            machine.transition(ContestState.RECONCILED);
            LOG.info("Contest reconciled: strategy={}, booths={}, outOfBooth={}",
                    selection.mapping().strategy(), reconciliation.records().size(),
                    reconciliation.result().totalOutOfBooth());
            return ContestOutcome.reconciled(contestId, selection.mapping(), reconciliation.records(),
                    reconciliation.result(), warnings, selection.attempts(), skipped);
        } catch (ReconciliationImpossibleException e) {
            machine.transition(ContestState.FAILED);
            LOG.warn("Contest failed: {}", e.getMessage());
            return ContestOutcome.failed(contestId, FailureKind.RECONCILIATION, selection.mapping(),
                    List.of(e.getMessage()), warnings, selection.attempts(), skipped);
        }
    }

    /**
     * Extracts all lines in order. The first row seen for a booth wins; later ones are skipped
     * as duplicates.
     */
    private List<RawBoothRow> extractRows(ContestInput input, List<SkippedLine> skipped) {
        List<RawBoothRow> rows = new ArrayList<>();
        Set<BoothId> seen = new HashSet<>();
        List<String> lines = input.lines();
        for (int i = 0; i < lines.size(); i++) {
            int lineNumber = i + 1;
            LineExtraction extraction = extractor.extract(lineNumber, lines.get(i), input);
            if (!extraction.isAccepted()) {
                skipped.add(extraction.skipped());
                continue;
            }
            RawBoothRow row = extraction.row();
            if (seen.add(row.boothId())) {
                rows.add(row);
            } else {
                LOG.debug("Line {} repeats booth {}; keeping the first occurrence", lineNumber, row.boothId());
                skipped.add(new SkippedLine(lineNumber, SkipReason.DUPLICATE_BOOTH, LogSanitizer.preview(lines.get(i))));
            }
        }
        return rows;
    }

    private void publish(ContestOutcome outcome) {
        Instant now = Instant.now();
        if (outcome.isReconciled()) {
            publisher.publishEvent(new ContestReconciledEvent(outcome.contestId(), outcome.mapping().strategy(),
                    outcome.records().size(), outcome.result().totalOutOfBooth(), outcome.warnings().size(), now));
        } else {
            publisher.publishEvent(new ContestFailedEvent(outcome.contestId(), outcome.failureKind(),
                    outcome.issues(), now));
        }
    }

    private void recordSkips(List<SkippedLine> skipped) {
        Map<SkipReason, Long> byReason = new EnumMap<>(SkipReason.class);
        for (SkippedLine s : skipped) {
            byReason.merge(s.reason(), 1L, Long::sum);
        }
        byReason.forEach(metrics::recordSkippedLines);
    }
}
