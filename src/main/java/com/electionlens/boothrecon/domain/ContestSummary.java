package com.electionlens.boothrecon.domain;

/**
 * Headline figures of a contest, derived from official totals with the
 * none-of-the-above slot excluded.
 *
 * @param winner   top contender
 * @param runnerUp second contender, or {@code null} in a single-contender contest
 * @param margin   winner votes minus runner-up votes
 */
public record ContestSummary(Candidate winner, Candidate runnerUp, int margin) {

    public static ContestSummary of(CandidateRoster roster) {
        var contenders = roster.contenders();
        if (contenders.isEmpty()) {
            return new ContestSummary(null, null, 0);
        }
        Candidate winner = roster.get(contenders.get(0));
        if (contenders.size() == 1) {
            return new ContestSummary(winner, null, winner.officialVotes());
        }
        Candidate runnerUp = roster.get(contenders.get(1));
        return new ContestSummary(winner, runnerUp, winner.officialVotes() - runnerUp.officialVotes());
    }
}
