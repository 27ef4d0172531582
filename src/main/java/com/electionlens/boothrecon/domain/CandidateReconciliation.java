package com.electionlens.boothrecon.domain;

/**
 * Reconciled figures for one candidate.
 *
 * <p>Invariant: {@code boothTotal + outOfBooth == officialTotal} and {@code outOfBooth >= 0}.
 *
 * @param candidateIndex index into the roster
 * @param name           candidate name
 * @param party          party code
 * @param boothTotal     sum of the candidate's booth-level votes after reconciliation
 * @param outOfBooth     votes not attributable to any booth (postal and similar)
 * @param officialTotal  authoritative total
 */
public record CandidateReconciliation(
        int candidateIndex,
        String name,
        String party,
        int boothTotal,
        int outOfBooth,
        int officialTotal
) {

    public CandidateReconciliation {
        if (outOfBooth < 0) {
            throw new IllegalArgumentException("outOfBooth must not be negative for " + name + ": " + outOfBooth);
        }
        if ((long) boothTotal + outOfBooth != officialTotal) {
            throw new IllegalArgumentException("boothTotal " + boothTotal + " + outOfBooth " + outOfBooth
                    + " != officialTotal " + officialTotal + " for " + name);
        }
    }
}
