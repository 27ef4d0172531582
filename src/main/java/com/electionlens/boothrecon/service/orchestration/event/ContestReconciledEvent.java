package com.electionlens.boothrecon.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a contest reaches RECONCILED.
 *
 * @param contestId     contest identifier
 * @param strategy      name of the accepted mapping strategy
 * @param booths        number of reconciled booth records
 * @param outOfBooth    total votes attributed outside the booth table
 * @param warningCount  audit warnings attached to the outcome
 * @param timestamp     when the contest finished
 */
public record ContestReconciledEvent(
        String contestId,
        String strategy,
        int booths,
        long outOfBooth,
        int warningCount,
        Instant timestamp
) {}
