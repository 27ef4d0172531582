package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.BoothId;
import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import com.electionlens.boothrecon.service.validation.ValidationCheck;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every record carries one vote per official candidate and booth identifiers are unique.
 * Violations are hard failures.
 */
@Component
@Order(10)
public class StructureCheck implements ValidationCheck {

    public static final String NAME = "structure";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        List<ValidationFinding> findings = new ArrayList<>();
        if (records.isEmpty()) {
            findings.add(ValidationFinding.failure(NAME, "no booth records"));
            return findings;
        }
        Set<BoothId> seen = new HashSet<>();
        for (BoothRecord r : records) {
            if (r.votes().size() != roster.size()) {
                findings.add(ValidationFinding.failure(NAME, "booth " + r.boothId() + " has "
                        + r.votes().size() + " vote columns, expected " + roster.size()));
            }
            if (!seen.add(r.boothId())) {
                findings.add(ValidationFinding.failure(NAME, "booth " + r.boothId() + " appears more than once"));
            }
        }
        return findings;
    }
}
