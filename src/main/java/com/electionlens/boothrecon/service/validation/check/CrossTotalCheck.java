package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.Candidate;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import com.electionlens.boothrecon.service.validation.ValidationCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compares booth sums of the top contenders with their official totals.
 *
 * <p>A relative error {@code |boothSum - official| / official} above the failure threshold is a
 * hard failure; above the warning threshold (and at most the failure threshold) it is a warning.
 */
@Component
@Order(40)
public class CrossTotalCheck implements ValidationCheck {

    public static final String NAME = "cross-total";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        List<Integer> contenders = roster.contenders();
        int n = Math.min(config.crossTotalCandidates(), contenders.size());
        List<ValidationFinding> findings = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            int index = contenders.get(k);
            Candidate c = roster.get(index);
            long boothSum = 0;
            for (BoothRecord r : records) {
                if (index < r.votes().size()) {
                    boothSum += r.vote(index);
                }
            }
            double error = relativeError(boothSum, c.officialVotes());
            if (error > config.crossTotalFailureThreshold()) {
                findings.add(ValidationFinding.failure(NAME, describe(c, boothSum, error)));
            } else if (error > config.crossTotalWarningThreshold()) {
                findings.add(ValidationFinding.warning(NAME, describe(c, boothSum, error)));
            }
        }
        return findings;
    }

    static double relativeError(long boothSum, int official) {
        if (official == 0) {
            return boothSum == 0 ? 0.0 : 1.0;
        }
        return Math.abs(boothSum - official) / (double) official;
    }

    private static String describe(Candidate c, long boothSum, double error) {
        return String.format(Locale.ROOT, "%s (%s): booth sum %d vs official %d (%.1f%% off)",
                c.name(), c.party(), boothSum, c.officialVotes(), error * 100);
    }
}
