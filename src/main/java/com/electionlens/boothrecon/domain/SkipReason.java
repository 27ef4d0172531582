package com.electionlens.boothrecon.domain;

public enum SkipReason {
    BLANK,
    HEADER,
    NO_BOOTH_ID,
    BELOW_QUORUM,
    DUPLICATE_BOOTH
}
