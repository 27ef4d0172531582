package com.electionlens.boothrecon.domain;

import java.util.List;

/**
 * Per-candidate reconciliation of booth sums against official totals for one contest.
 *
 * @param candidates one entry per roster candidate, in roster order
 * @param summary    winner, runner-up and margin
 */
public record ReconciliationResult(List<CandidateReconciliation> candidates, ContestSummary summary) {

    public ReconciliationResult {
        candidates = List.copyOf(candidates);
    }

    public CandidateReconciliation forCandidate(int index) {
        return candidates.get(index);
    }

    public long totalOutOfBooth() {
        long sum = 0;
        for (CandidateReconciliation c : candidates) {
            sum += c.outOfBooth();
        }
        return sum;
    }

    public long totalBoothVotes() {
        long sum = 0;
        for (CandidateReconciliation c : candidates) {
            sum += c.boothTotal();
        }
        return sum;
    }
}
