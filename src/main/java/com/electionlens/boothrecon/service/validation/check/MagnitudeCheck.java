package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import com.electionlens.boothrecon.service.validation.ValidationCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Every vote value must lie in {@code [0, maxVotesPerBooth]}. Hard failure.
 */
@Component
@Order(30)
public class MagnitudeCheck implements ValidationCheck {

    public static final String NAME = "magnitude";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        int ceiling = config.maxVotesPerBooth();
        List<ValidationFinding> findings = new ArrayList<>();
        for (BoothRecord r : records) {
            for (int i = 0; i < r.votes().size(); i++) {
                int v = r.vote(i);
                if (v < 0) {
                    findings.add(ValidationFinding.failure(NAME, "booth " + r.boothId()
                            + " column " + i + " is negative: " + v));
                } else if (v > ceiling) {
                    findings.add(ValidationFinding.failure(NAME, "booth " + r.boothId()
                            + " column " + i + " value " + v + " exceeds ceiling " + ceiling));
                }
            }
        }
        return findings;
    }
}
