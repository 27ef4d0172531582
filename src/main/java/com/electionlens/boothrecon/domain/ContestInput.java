package com.electionlens.boothrecon.domain;

import com.electionlens.boothrecon.exception.InvalidContestDataException;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the pipeline needs to process one contest.
 *
 * @param contestId          caller-chosen contest identifier (e.g., "TN-001")
 * @param lines              raw text lines from the extraction service, in page order
 * @param roster             ranked official candidates
 * @param knownBoothIds      valid booth identifiers, empty when unknown
 * @param declaredOutOfBooth per-candidate postal votes read from the sheet, in roster order;
 *                           empty when the sheet carried none
 * @param config             tuning constants for this contest
 */
public record ContestInput(
        String contestId,
        List<String> lines,
        CandidateRoster roster,
        Set<BoothId> knownBoothIds,
        List<Integer> declaredOutOfBooth,
        ContestConfig config
) {

    public ContestInput {
        Objects.requireNonNull(contestId, "contestId");
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(config, "config");
        lines = lines == null ? List.of() : lines.stream().map(l -> l == null ? "" : l).toList();
        knownBoothIds = knownBoothIds == null ? Set.of() : Set.copyOf(knownBoothIds);
        declaredOutOfBooth = declaredOutOfBooth == null ? List.of() : List.copyOf(declaredOutOfBooth);

        if (!declaredOutOfBooth.isEmpty()) {
            if (declaredOutOfBooth.size() != roster.size()) {
                throw new InvalidContestDataException("Declared out-of-booth votes for " + contestId + " have "
                        + declaredOutOfBooth.size() + " entries, expected " + roster.size());
            }
            for (int i = 0; i < roster.size(); i++) {
                int declared = declaredOutOfBooth.get(i);
                Candidate c = roster.get(i);
                if (declared < 0 || declared > c.officialVotes()) {
                    throw new InvalidContestDataException("Declared out-of-booth votes for " + c.name()
                            + " must be within [0," + c.officialVotes() + "], got: " + declared);
                }
            }
        }
    }

    public static ContestInput of(String contestId, List<String> lines, CandidateRoster roster, ContestConfig config) {
        return new ContestInput(contestId, lines, roster, Set.of(), List.of(), config);
    }

    public boolean hasDeclaredOutOfBooth() {
        return !declaredOutOfBooth.isEmpty();
    }
}
