package com.electionlens.boothrecon.domain;

import com.electionlens.boothrecon.exception.InvalidContestDataException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ranked, immutable list of a contest's official candidates.
 *
 * <p>Candidates are ordered by descending official votes; index {@code i} of every
 * {@link BoothRecord#votes()} refers to {@code get(i)}. The roster is loaded once per
 * contest and is safe to share read-only across threads.
 *
 * <p>The none-of-the-above slot (if present) is recognised by its party code and is
 * excluded from winner determination.
 */
public final class CandidateRoster {

    public static final String DEFAULT_NONE_OF_THE_ABOVE_PARTY = "NOTA";

    private final List<Candidate> candidates;
    private final int noneOfTheAboveIndex;

    private CandidateRoster(List<Candidate> candidates, int noneOfTheAboveIndex) {
        this.candidates = List.copyOf(candidates);
        this.noneOfTheAboveIndex = noneOfTheAboveIndex;
    }

    /**
     * Ranks official entries using the default none-of-the-above party code.
     *
     * @param entries official entries in any order
     * @return ranked roster
     * @throws InvalidContestDataException if entries are empty, negative or duplicated
     */
    public static CandidateRoster rank(List<OfficialEntry> entries) {
        return rank(entries, DEFAULT_NONE_OF_THE_ABOVE_PARTY);
    }

    /**
     * Ranks official entries by descending votes. Equal totals keep their input order.
     *
     * @param entries official entries in any order
     * @param noneOfTheAboveParty party code identifying the none-of-the-above slot
     * @return ranked roster
     * @throws InvalidContestDataException if entries are empty, negative or duplicated
     */
    public static CandidateRoster rank(List<OfficialEntry> entries, String noneOfTheAboveParty) {
        if (entries == null || entries.isEmpty()) {
            throw new InvalidContestDataException("Official totals contain no candidates");
        }
        Set<String> seen = new HashSet<>();
        for (OfficialEntry e : entries) {
            if (e == null || e.name() == null || e.party() == null) {
                throw new InvalidContestDataException("Official entry is missing name or party: " + e);
            }
            if (e.votes() < 0) {
                throw new InvalidContestDataException("Official votes must not be negative: "
                        + e.name() + " (" + e.party() + ") = " + e.votes());
            }
            String key = e.name().trim().toUpperCase(Locale.ROOT) + '|' + e.party().trim().toUpperCase(Locale.ROOT);
            if (!seen.add(key)) {
                throw new InvalidContestDataException("Duplicate official candidate: "
                        + e.name() + " (" + e.party() + ")");
            }
        }

        List<OfficialEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(OfficialEntry::votes).reversed());

        List<Candidate> ranked = new ArrayList<>(sorted.size());
        int nota = -1;
        for (int i = 0; i < sorted.size(); i++) {
            OfficialEntry e = sorted.get(i);
            ranked.add(new Candidate(e.name(), e.party(), e.votes(), i));
            if (nota < 0 && noneOfTheAboveParty != null && noneOfTheAboveParty.equalsIgnoreCase(e.party().trim())) {
                nota = i;
            }
        }
        return new CandidateRoster(ranked, nota);
    }

    public int size() {
        return candidates.size();
    }

    public Candidate get(int index) {
        return candidates.get(index);
    }

    public List<Candidate> candidates() {
        return candidates;
    }

    /**
     * @return index of the none-of-the-above slot, or empty if the contest has none
     */
    public OptionalInt noneOfTheAboveIndex() {
        return noneOfTheAboveIndex < 0 ? OptionalInt.empty() : OptionalInt.of(noneOfTheAboveIndex);
    }

    public boolean isNoneOfTheAbove(int index) {
        return index == noneOfTheAboveIndex;
    }

    /**
     * Candidate indices in rank order with the none-of-the-above slot removed.
     */
    public List<Integer> contenders() {
        List<Integer> result = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (i != noneOfTheAboveIndex) {
                result.add(i);
            }
        }
        return List.copyOf(result);
    }

    public long totalOfficialVotes() {
        long sum = 0;
        for (Candidate c : candidates) {
            sum += c.officialVotes();
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CandidateRoster other)) {
            return false;
        }
        return noneOfTheAboveIndex == other.noneOfTheAboveIndex && candidates.equals(other.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates, noneOfTheAboveIndex);
    }

    @Override
    public String toString() {
        return "CandidateRoster" + candidates;
    }
}
