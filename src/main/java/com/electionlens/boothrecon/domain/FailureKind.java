package com.electionlens.boothrecon.domain;

/**
 * Why a contest ended in {@link ContestState#FAILED}.
 */
public enum FailureKind {
    /** No line yielded a booth row. */
    NO_DATA,
    /** Every mapping attempt failed validation. */
    MAPPING,
    /** Booth sums could not be brought to the official target without negative votes. */
    RECONCILIATION
}
