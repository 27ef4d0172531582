package com.electionlens.boothrecon.domain;

/**
 * One strategy's mapping together with the validation verdict it received.
 */
public record MappingAttempt(String strategy, ColumnMapping mapping, ValidationReport report) {

    public boolean accepted() {
        return report.passed();
    }
}
