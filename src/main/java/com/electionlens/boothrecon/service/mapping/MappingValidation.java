package com.electionlens.boothrecon.service.mapping;

import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ValidationReport;

/**
 * Judges a candidate mapping; supplied by the caller of {@link ColumnMapper}.
 */
@FunctionalInterface
public interface MappingValidation {

    ValidationReport validate(ColumnMapping mapping);
}
