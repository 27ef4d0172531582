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
 * Flags a booth whose own number appears in its leading vote columns, the signature of a booth
 * identifier leaking into the vote array. Always a hard failure.
 */
@Component
@Order(20)
public class SelfReferenceCheck implements ValidationCheck {

    public static final String NAME = "self-reference";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (BoothRecord r : records) {
            int booth = r.boothId().number();
            int scan = Math.min(config.selfReferenceColumns(), r.votes().size());
            for (int i = 0; i < scan; i++) {
                if (r.vote(i) == booth) {
                    findings.add(ValidationFinding.failure(NAME, "booth " + r.boothId()
                            + " has its own number in vote column " + i));
                    break;
                }
            }
        }
        return findings;
    }
}
