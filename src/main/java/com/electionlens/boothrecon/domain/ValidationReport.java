package com.electionlens.boothrecon.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one validation attempt.
 *
 * @param passed   true iff there are no hard failures
 * @param issues   hard failures in the order the checks reported them
 * @param warnings findings below the failure threshold, surfaced for audit
 */
public record ValidationReport(boolean passed, List<String> issues, List<String> warnings) {

    public ValidationReport {
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
        if (passed != issues.isEmpty()) {
            throw new IllegalArgumentException("passed must be true exactly when there are no issues");
        }
    }

    public static ValidationReport from(List<ValidationFinding> findings) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ValidationFinding f : findings) {
            if (f.isFailure()) {
                issues.add(f.toString());
            } else {
                warnings.add(f.toString());
            }
        }
        return new ValidationReport(issues.isEmpty(), issues, warnings);
    }
}
