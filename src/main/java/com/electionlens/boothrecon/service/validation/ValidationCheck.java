package com.electionlens.boothrecon.service.validation;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;

import java.util.List;

/**
 * One independent audit of a contest's mapped booth records.
 *
 * <p>Implementations are stateless; findings are returned in a deterministic order so that
 * issue lists are reproducible across runs.
 */
public interface ValidationCheck {

    /**
     * Short check name used as the prefix of every finding.
     */
    String name();

    /**
     * @param records mapped records in official candidate order
     * @param roster  official candidates
     * @param config  contest thresholds
     * @return findings, empty when the records pass
     */
    List<ValidationFinding> check(List<BoothRecord> records, CandidateRoster roster, ContestConfig config);
}
