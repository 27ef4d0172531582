package com.electionlens.boothrecon.service.mapping.impl;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.service.mapping.AbstractColumnMappingStrategy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assumes the sheet prints candidates in official ranking order: column {@code i} is
 * candidate {@code i}. The default hypothesis; no computation over the rows.
 */
public final class PositionalMappingStrategy extends AbstractColumnMappingStrategy {

    public static final String NAME = "positional";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected ColumnMapping doInfer(List<RawBoothRow> rows, CandidateRoster roster,
                                    ContestConfig config, int columns) {
        Map<Integer, Integer> assignments = new HashMap<>();
        for (int i = 0; i < columns; i++) {
            assignments.put(i, i);
        }
        return ColumnMapping.of(NAME, roster.size(), assignments);
    }
}
