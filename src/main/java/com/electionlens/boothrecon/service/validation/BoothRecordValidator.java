package com.electionlens.boothrecon.service.validation;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import com.electionlens.boothrecon.domain.ValidationReport;
import com.electionlens.boothrecon.service.validation.check.CrossTotalCheck;
import com.electionlens.boothrecon.service.validation.check.MagnitudeCheck;
import com.electionlens.boothrecon.service.validation.check.SelfReferenceCheck;
import com.electionlens.boothrecon.service.validation.check.StructureCheck;
import com.electionlens.boothrecon.service.validation.check.WinnerDistributionCheck;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every {@link ValidationCheck} and concatenates their findings into one report.
 *
 * <p>Checks run in their {@link org.springframework.core.annotation.Order} and never short-circuit,
 * so a failed contest lists every problem at once. The report passes iff no check produced a hard
 * failure; warnings are carried for audit.
 */
@Service
public class BoothRecordValidator {

    private static final Logger LOG = LogManager.getLogger(BoothRecordValidator.class);

    private final List<ValidationCheck> checks;

    public BoothRecordValidator(List<ValidationCheck> checks) {
        Objects.requireNonNull(checks, "checks");
        if (checks.isEmpty()) {
            throw new IllegalArgumentException("At least one validation check is required");
        }
        this.checks = List.copyOf(checks);
    }

    /**
     * Validator wired with the standard checks, for use outside a Spring context.
     */
    public static BoothRecordValidator withDefaultChecks() {
        return new BoothRecordValidator(List.of(
                new StructureCheck(),
                new SelfReferenceCheck(),
                new MagnitudeCheck(),
                new CrossTotalCheck(),
                new WinnerDistributionCheck()));
    }

    public List<ValidationCheck> checks() {
        return checks;
    }

    public ValidationReport validate(List<BoothRecord> records, CandidateRoster roster, ContestConfig config) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(roster, "roster");
        Objects.requireNonNull(config, "config");

        List<ValidationFinding> findings = new ArrayList<>();
        for (ValidationCheck check : checks) {
            List<ValidationFinding> found = check.check(records, roster, config);
            if (!found.isEmpty()) {
                LOG.debug("Check {} produced {} finding(s)", check.name(), found.size());
            }
            findings.addAll(found);
        }
        return ValidationReport.from(findings);
    }
}
