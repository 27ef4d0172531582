package com.electionlens.boothrecon.service.mapping;

import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.MappingAttempt;
import com.electionlens.boothrecon.domain.ValidationReport;

import java.util.List;

/**
 * The accepted mapping of a contest and every attempt made to reach it.
 *
 * @param mapping  first mapping that passed validation
 * @param report   its validation report (may carry warnings)
 * @param attempts all attempts in order, the accepted one last
 */
public record MappingSelection(ColumnMapping mapping, ValidationReport report, List<MappingAttempt> attempts) {

    public MappingSelection {
        attempts = List.copyOf(attempts);
    }
}
