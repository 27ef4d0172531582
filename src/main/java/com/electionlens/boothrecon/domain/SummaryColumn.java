package com.electionlens.boothrecon.domain;

/**
 * Trailing per-row summary columns of a results sheet, in the order they are printed.
 */
public enum SummaryColumn {
    VALID_TOTAL,
    REJECTED,
    NONE_OF_THE_ABOVE,
    GRAND_TOTAL
}
