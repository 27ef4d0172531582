package com.electionlens.boothrecon.domain;

import java.util.Objects;

/**
 * Immutable official-totals entry for one candidate of a contest.
 *
 * @param name          display name as published with the official totals
 * @param party         party code (e.g., "DMK", "IND", "NOTA")
 * @param officialVotes authoritative vote total (never negative)
 * @param position      rank by official votes, 0 = winner
 */
public record Candidate(
        String name,
        String party,
        int officialVotes,
        int position
) {

    public Candidate {
        Objects.requireNonNull(name, "Candidate name must not be null");
        Objects.requireNonNull(party, "Candidate party must not be null");
        if (officialVotes < 0) {
            throw new IllegalArgumentException(
                    "Official votes must not be negative, got: " + officialVotes + " for " + name);
        }
        if (position < 0) {
            throw new IllegalArgumentException("Position must not be negative, got: " + position);
        }
    }
}
