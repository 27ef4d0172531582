package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import com.electionlens.boothrecon.service.validation.ValidationCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The two candidates winning the most booths should be the two official front-runners.
 *
 * <p>A booth's local winner is its largest vote, none-of-the-above excluded, equal votes going to
 * the higher-ranked candidate; booths with no votes are ignored. A runner-up that wins no booth
 * counts as a mismatch. A mismatch is only ever a warning, since a close and spatially polarized
 * contest can produce it legitimately.
 */
@Component
@Order(50)
public class WinnerDistributionCheck implements ValidationCheck {

    public static final String NAME = "winner-distribution";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        List<Integer> contenders = roster.contenders();
        if (contenders.isEmpty()) {
            return List.of();
        }
        int[] wins = new int[roster.size()];
        for (BoothRecord r : records) {
            int winner = localWinner(r, contenders);
            if (winner >= 0) {
                wins[winner]++;
            }
        }

        List<Integer> byWins = IntStream.range(0, wins.length)
                .filter(i -> wins[i] > 0)
                .boxed()
                .sorted(Comparator.<Integer>comparingInt(i -> wins[i]).reversed())
                .toList();
        if (byWins.isEmpty()) {
            return List.of();
        }

        // a runner-up that wins no booth at all leaves fewer winners than front-runners
        int compared = Math.min(2, contenders.size());
        List<Integer> topWinners = byWins.subList(0, Math.min(compared, byWins.size()));
        List<Integer> frontRunners = contenders.subList(0, compared);
        if (Set.copyOf(topWinners).equals(Set.copyOf(frontRunners))) {
            return List.of();
        }

        List<ValidationFinding> findings = new ArrayList<>();
        findings.add(ValidationFinding.warning(NAME, "top booth winners " + names(topWinners, roster, wins)
                + " differ from official front-runners " + names(frontRunners, roster, wins)));
        return findings;
    }

    /**
     * @return index of the booth's winning contender, or -1 if it has no contender votes
     */
    static int localWinner(BoothRecord record, List<Integer> contenders) {
        int best = -1;
        int bestVotes = 0;
        for (int c : contenders) {
            if (c >= record.votes().size()) {
                continue;
            }
            int v = record.vote(c);
            if (v > bestVotes) {
                bestVotes = v;
                best = c;
            }
        }
        return best;
    }

    private static String names(List<Integer> indexes, CandidateRoster roster, int[] wins) {
        return indexes.stream()
                .map(i -> roster.get(i).name() + "=" + wins[i])
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
