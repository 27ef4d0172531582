package com.electionlens.boothrecon.domain;

/**
 * Lifecycle of one contest run.
 *
 * <pre>
 * EXTRACTED → MAPPED → VALIDATED → RECONCILED
 *     ↑          │          │
 *     └─ retry ──┘          └→ FAILED
 * </pre>
 * {@code FAILED} is also reachable from {@code EXTRACTED} (no data) and {@code MAPPED}
 * (mapping strategies exhausted).
 */
public enum ContestState {
    EXTRACTED,
    MAPPED,
    VALIDATED,
    RECONCILED,
    FAILED;

    public boolean isTerminal() {
        return this == RECONCILED || this == FAILED;
    }
}
