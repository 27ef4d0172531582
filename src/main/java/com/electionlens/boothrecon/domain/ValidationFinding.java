package com.electionlens.boothrecon.domain;

import java.util.Objects;

/**
 * One itemized finding of a validation check.
 *
 * @param severity whether the finding blocks acceptance
 * @param check    short name of the check that produced it
 * @param message  human-readable description
 */
public record ValidationFinding(Severity severity, String check, String message) {

    public enum Severity { FAILURE, WARNING }

    public ValidationFinding {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(check, "check");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationFinding failure(String check, String message) {
        return new ValidationFinding(Severity.FAILURE, check, message);
    }

    public static ValidationFinding warning(String check, String message) {
        return new ValidationFinding(Severity.WARNING, check, message);
    }

    public boolean isFailure() {
        return severity == Severity.FAILURE;
    }

    @Override
    public String toString() {
        return "[" + check + "] " + message;
    }
}
