package com.electionlens.boothrecon.domain;

import java.util.List;
import java.util.Objects;

/**
 * Final, unambiguous outcome of one contest run: either {@link ContestState#RECONCILED}
 * with records and result, or {@link ContestState#FAILED} with an itemized issue list and
 * no booth data.
 *
 * @param contestId    contest identifier
 * @param state        RECONCILED or FAILED
 * @param failureKind  set only when FAILED
 * @param mapping      accepted mapping, or the best-attempted one when mapping failed
 * @param records      reconciled booth records in booth order (empty when FAILED)
 * @param result       per-candidate reconciliation (null when FAILED)
 * @param warnings     audit findings that did not block acceptance
 * @param issues       itemized failure reasons (empty when RECONCILED)
 * @param attempts     every mapping attempt, in the order tried
 * @param skippedLines source lines that did not become booth rows
 */
public record ContestOutcome(
        String contestId,
        ContestState state,
        FailureKind failureKind,
        ColumnMapping mapping,
        List<BoothRecord> records,
        ReconciliationResult result,
        List<String> warnings,
        List<String> issues,
        List<MappingAttempt> attempts,
        List<SkippedLine> skippedLines
) {

    public ContestOutcome {
        Objects.requireNonNull(contestId, "contestId");
        if (state != ContestState.RECONCILED && state != ContestState.FAILED) {
            throw new IllegalArgumentException("Outcome state must be terminal, got: " + state);
        }
        if ((state == ContestState.FAILED) != (failureKind != null)) {
            throw new IllegalArgumentException("failureKind must be set exactly when state is FAILED");
        }
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
        issues = List.copyOf(issues);
        attempts = List.copyOf(attempts);
        skippedLines = List.copyOf(skippedLines);
    }

    public static ContestOutcome reconciled(String contestId, ColumnMapping mapping, List<BoothRecord> records,
                                            ReconciliationResult result, List<String> warnings,
                                            List<MappingAttempt> attempts, List<SkippedLine> skippedLines) {
        Objects.requireNonNull(result, "result");
        return new ContestOutcome(contestId, ContestState.RECONCILED, null, mapping, records, result,
                warnings, List.of(), attempts, skippedLines);
    }

    public static ContestOutcome failed(String contestId, FailureKind kind, ColumnMapping bestMapping,
                                        List<String> issues, List<String> warnings,
                                        List<MappingAttempt> attempts, List<SkippedLine> skippedLines) {
        Objects.requireNonNull(kind, "kind");
        if (issues.isEmpty()) {
            throw new IllegalArgumentException("A failed outcome must carry at least one issue");
        }
        return new ContestOutcome(contestId, ContestState.FAILED, kind, bestMapping, List.of(), null,
                warnings, issues, attempts, skippedLines);
    }

    public boolean isReconciled() {
        return state == ContestState.RECONCILED;
    }
}
