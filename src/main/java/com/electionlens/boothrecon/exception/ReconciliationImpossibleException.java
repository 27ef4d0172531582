package com.electionlens.boothrecon.exception;

/**
 * Thrown when a candidate's booth votes cannot be adjusted to the official target
 * without driving some booth below zero. This points at a magnitude problem rather than
 * column identity.
 */
public class ReconciliationImpossibleException extends BoothReconException {

    private final int candidateIndex;
    private final String candidateName;
    private final int target;
    private final int achieved;

    public ReconciliationImpossibleException(int candidateIndex, String candidateName, int target, int achieved) {
        super("Cannot reconcile " + candidateName + " (candidate " + candidateIndex + "): booth target "
                + target + " but non-negative booth votes sum to " + achieved);
        this.candidateIndex = candidateIndex;
        this.candidateName = candidateName;
        this.target = target;
        this.achieved = achieved;
    }

    public ReconciliationImpossibleException(String message) {
        super(message);
        this.candidateIndex = -1;
        this.candidateName = "unknown";
        this.target = 0;
        this.achieved = 0;
    }

    public int getCandidateIndex() {
        return candidateIndex;
    }

    public String getCandidateName() {
        return candidateName;
    }

    public int getTarget() {
        return target;
    }

    public int getAchieved() {
        return achieved;
    }
}
