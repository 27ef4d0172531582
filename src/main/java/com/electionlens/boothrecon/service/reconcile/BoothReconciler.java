package com.electionlens.boothrecon.service.reconcile;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.Candidate;
import com.electionlens.boothrecon.domain.CandidateReconciliation;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestSummary;
import com.electionlens.boothrecon.domain.ReconciliationResult;
import com.electionlens.boothrecon.exception.ReconciliationImpossibleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Makes booth-level sums agree exactly with the official totals.
 *
 * <p>For each candidate the gap {@code delta = target - boothSum} is spread over all booths in
 * ascending {@link com.electionlens.boothrecon.domain.BoothId} order: every booth receives
 * {@code floorDiv(delta, booths)} and the first {@code floorMod(delta, booths)} booths one more.
 * The target is the official total, or the official total minus the declared out-of-booth votes
 * when the sheet carried them.
 *
 * <p>Adjusted values are clamped at zero. If clamping leaves the booth sum short of the target
 * the contest cannot be reconciled and {@link ReconciliationImpossibleException} is thrown;
 * records are never partially adjusted.
 */
@Component
public class BoothReconciler {

    private static final Logger LOG = LogManager.getLogger(BoothReconciler.class);

    public Reconciliation reconcile(List<BoothRecord> records, CandidateRoster roster) {
        return reconcile(records, roster, List.of());
    }

    /**
     * @param records            validated records in official candidate order
     * @param roster             official candidates
     * @param declaredOutOfBooth per-candidate declared postal votes, or empty
     * @return adjusted records in booth order and the per-candidate figures
     * @throws ReconciliationImpossibleException if there are no records or a target cannot be reached
     */
    public Reconciliation reconcile(List<BoothRecord> records, CandidateRoster roster,
                                    List<Integer> declaredOutOfBooth) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(declaredOutOfBooth, "declaredOutOfBooth");
        if (records.isEmpty()) {
            throw new ReconciliationImpossibleException("no booth records");
        }
        if (!declaredOutOfBooth.isEmpty() && declaredOutOfBooth.size() != roster.size()) {
            throw new IllegalArgumentException("declaredOutOfBooth must have " + roster.size()
                    + " entries, got " + declaredOutOfBooth.size());
        }

        List<BoothRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(BoothRecord::boothId));
        int booths = ordered.size();
        int[][] votes = new int[booths][];
        for (int b = 0; b < booths; b++) {
            votes[b] = ordered.get(b).votesArray();
        }

        List<CandidateReconciliation> perCandidate = new ArrayList<>(roster.size());
        for (int c = 0; c < roster.size(); c++) {
            Candidate candidate = roster.get(c);
            int declared = declaredOutOfBooth.isEmpty() ? 0 : declaredOutOfBooth.get(c);
            int target = candidate.officialVotes() - declared;

            long boothSum = columnSum(votes, c);
            long delta = target - boothSum;
            if (delta != 0) {
                distribute(votes, c, delta);
                long adjusted = columnSum(votes, c);
                if (adjusted != target) {
                    throw new ReconciliationImpossibleException(c, candidate.name(), target, (int) adjusted);
                }
                LOG.debug("Candidate {} adjusted by {} across {} booths", candidate.name(), delta, booths);
            }
            perCandidate.add(new CandidateReconciliation(c, candidate.name(), candidate.party(),
                    target, candidate.officialVotes() - target, candidate.officialVotes()));
        }

        List<BoothRecord> adjusted = new ArrayList<>(booths);
        for (int b = 0; b < booths; b++) {
            adjusted.add(BoothRecord.of(ordered.get(b).boothId(), votes[b]));
        }
        return new Reconciliation(adjusted, new ReconciliationResult(perCandidate, ContestSummary.of(roster)));
    }

    private static void distribute(int[][] votes, int candidate, long delta) {
        int booths = votes.length;
        long perBooth = Math.floorDiv(delta, booths);
        long remainder = Math.floorMod(delta, booths);
        for (int b = 0; b < booths; b++) {
            long value = votes[b][candidate] + perBooth + (b < remainder ? 1 : 0);
            votes[b][candidate] = (int) Math.max(0, Math.min(Integer.MAX_VALUE, value));
        }
    }

    private static long columnSum(int[][] votes, int candidate) {
        long sum = 0;
        for (int[] row : votes) {
            sum += row[candidate];
        }
        return sum;
    }
}
