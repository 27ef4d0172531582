package com.electionlens.boothrecon.service.mapping.impl;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.service.mapping.AbstractColumnMappingStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Matches extracted columns to candidates by comparing column totals with official totals.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Sum each column over all rows</li>
 *   <li>Scale-corrected variant only: multiply every column total by
 *       {@code sum(official) / sum(columns)} to undo proportional under-coverage</li>
 *   <li>Visit columns by descending total (equal totals in extraction order) and assign each to
 *       the unassigned candidate with the smallest relative difference
 *       {@code |columnTotal - official| / official}</li>
 *   <li>Accept a pair only if {@code |columnTotal - official| <= ceiling * official + slackVotes};
 *       a column with no acceptable candidate stays unmapped</li>
 *   <li>If an unassigned column earlier in extraction order lies exactly as far from the chosen
 *       candidate, that earlier column takes the candidate instead and the visited column
 *       looks again</li>
 * </ol>
 * Equally close candidates resolve to the smaller index (the higher-ranked candidate); equally
 * close columns resolve to the smaller column index.
 */
public final class VoteTotalMappingStrategy extends AbstractColumnMappingStrategy {

    public static final String NAME = "vote-total";
    public static final String SCALED_NAME = "scaled-vote-total";

    private static final Logger LOG = LogManager.getLogger(VoteTotalMappingStrategy.class);

    private final boolean scaleCorrected;

    /**
     * @param scaleCorrected whether to rescale column totals to the official grand total first
     */
    public VoteTotalMappingStrategy(boolean scaleCorrected) {
        this.scaleCorrected = scaleCorrected;
    }

    @Override
    public String name() {
        return scaleCorrected ? SCALED_NAME : NAME;
    }

    @Override
    protected ColumnMapping doInfer(List<RawBoothRow> rows, CandidateRoster roster,
                                    ContestConfig config, int columns) {
        long[] totals = columnTotals(rows, columns);
        double scale = scaleCorrected ? scaleFactor(totals, roster) : 1.0;

        List<Integer> visitOrder = IntStream.range(0, columns).boxed()
                .sorted(Comparator.<Integer>comparingLong(c -> totals[c]).reversed())
                .toList();

        boolean[] taken = new boolean[roster.size()];
        boolean[] assigned = new boolean[columns];
        Map<Integer, Integer> assignments = new HashMap<>();
        for (int column : visitOrder) {
            while (!assigned[column]) {
                double observed = totals[column] * scale;
                int match = closestCandidate(observed, roster, taken, config);
                if (match < 0) {
                    LOG.debug("{}: column {} (total {}) has no candidate within tolerance",
                            name(), column, Math.round(observed));
                    break;
                }
                int claimant = earliestEquallyClose(column, match, totals, scale, assigned, roster);
                taken[match] = true;
                assigned[claimant] = true;
                assignments.put(claimant, match);
            }
        }
        return ColumnMapping.of(name(), roster.size(), assignments);
    }

    /**
     * @return the lowest unassigned column index whose distance to {@code candidate} equals that
     *         of {@code column}, or {@code column} itself
     */
    private static int earliestEquallyClose(int column, int candidate, long[] totals, double scale,
                                            boolean[] assigned, CandidateRoster roster) {
        int official = roster.get(candidate).officialVotes();
        double diff = Math.abs(totals[column] * scale - official);
        for (int earlier = 0; earlier < column; earlier++) {
            if (!assigned[earlier] && Math.abs(totals[earlier] * scale - official) == diff) {
                return earlier;
            }
        }
        return column;
    }

    private static int closestCandidate(double observed, CandidateRoster roster, boolean[] taken,
                                        ContestConfig config) {
        int best = -1;
        double bestRelative = Double.POSITIVE_INFINITY;
        for (int c = 0; c < roster.size(); c++) {
            if (taken[c]) {
                continue;
            }
            int official = roster.get(c).officialVotes();
            double diff = Math.abs(observed - official);
            if (diff > config.mappingCeiling() * official + config.mappingSlackVotes()) {
                continue;
            }
            double relative = diff / Math.max(official, 1);
            // strict comparison keeps the smaller index on ties
            if (relative < bestRelative) {
                bestRelative = relative;
                best = c;
            }
        }
        return best;
    }

    private static double scaleFactor(long[] totals, CandidateRoster roster) {
        long columnSum = 0;
        for (long t : totals) {
            columnSum += t;
        }
        if (columnSum == 0) {
            return 1.0;
        }
        return (double) roster.totalOfficialVotes() / columnSum;
    }
}
