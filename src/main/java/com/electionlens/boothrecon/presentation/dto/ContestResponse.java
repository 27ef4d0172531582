package com.electionlens.boothrecon.presentation.dto;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateReconciliation;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestOutcome;
import com.electionlens.boothrecon.domain.ContestState;
import com.electionlens.boothrecon.domain.ContestSummary;
import com.electionlens.boothrecon.domain.FailureKind;
import com.electionlens.boothrecon.domain.MappingAttempt;
import com.electionlens.boothrecon.domain.SkippedLine;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a {@link ContestOutcome}.
 */
public record ContestResponse(
        String contestId,
        ContestState state,
        FailureKind failureKind,
        MappingView mapping,
        List<BoothView> booths,
        List<CandidateReconciliation> candidates,
        ContestSummary summary,
        List<String> warnings,
        List<String> issues,
        List<AttemptView> attempts,
        List<SkippedLine> skippedLines
) {

    public static ContestResponse from(ContestOutcome outcome) {
        return new ContestResponse(
                outcome.contestId(),
                outcome.state(),
                outcome.failureKind(),
                MappingView.from(outcome.mapping()),
                outcome.records().stream().map(BoothView::from).toList(),
                outcome.result() == null ? List.of() : outcome.result().candidates(),
                outcome.result() == null ? null : outcome.result().summary(),
                outcome.warnings(),
                outcome.issues(),
                outcome.attempts().stream().map(AttemptView::from).toList(),
                outcome.skippedLines());
    }

    /**
     * @param strategy          strategy that produced the mapping
     * @param columnToCandidate extracted column index to roster index
     */
    public record MappingView(String strategy, Map<Integer, Integer> columnToCandidate) {
        static MappingView from(ColumnMapping mapping) {
            return mapping == null ? null : new MappingView(mapping.strategy(), mapping.assignments());
        }
    }

    public record BoothView(String boothId, List<Integer> votes, int total) {
        static BoothView from(BoothRecord r) {
            return new BoothView(r.boothId().toString(), r.votes(), r.total());
        }
    }

    public record AttemptView(String strategy, boolean passed, List<String> issues, List<String> warnings) {
        static AttemptView from(MappingAttempt a) {
            return new AttemptView(a.strategy(), a.accepted(), a.report().issues(), a.report().warnings());
        }
    }
}
