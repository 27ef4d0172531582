package com.electionlens.boothrecon.service.orchestration.event;

import com.electionlens.boothrecon.domain.FailureKind;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when a contest ends in FAILED.
 *
 * @param contestId contest identifier
 * @param kind      no data, mapping, or reconciliation
 * @param issues    itemized issues, in order
 * @param timestamp when the contest finished
 */
public record ContestFailedEvent(
        String contestId,
        FailureKind kind,
        List<String> issues,
        Instant timestamp
) {
    public ContestFailedEvent {
        issues = List.copyOf(issues);
    }
}
