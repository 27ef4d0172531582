package com.electionlens.boothrecon.service.mapping;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.RawBoothRow;

import java.util.List;
import java.util.Map;

/**
 * Base class for mapping strategies implementing the common empty-input handling.
 *
 * <p>{@link #infer} returns an empty mapping when there are no rows or no vote columns and
 * otherwise delegates to {@link #doInfer} with the number of candidate-vote columns seen
 * (the widest row, never more than the roster size).
 */
public abstract class AbstractColumnMappingStrategy implements ColumnMappingStrategy {

    @Override
    public final ColumnMapping infer(List<RawBoothRow> rows, CandidateRoster roster, ContestConfig config) {
        int columns = columnCount(rows, roster);
        if (columns == 0) {
            return ColumnMapping.of(name(), roster.size(), Map.of());
        }
        return doInfer(rows, roster, config, columns);
    }

    /**
     * @param columns number of candidate-vote columns, at least 1
     */
    protected abstract ColumnMapping doInfer(List<RawBoothRow> rows, CandidateRoster roster,
                                             ContestConfig config, int columns);

    /**
     * Sums each column over all rows; rows shorter than {@code columns} contribute nothing
     * to the missing positions.
     */
    protected static long[] columnTotals(List<RawBoothRow> rows, int columns) {
        long[] totals = new long[columns];
        for (RawBoothRow row : rows) {
            for (int c = 0; c < columns && c < row.columnCount(); c++) {
                totals[c] += row.token(c);
            }
        }
        return totals;
    }

    private static int columnCount(List<RawBoothRow> rows, CandidateRoster roster) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        int widest = 0;
        for (RawBoothRow row : rows) {
            widest = Math.max(widest, row.columnCount());
        }
        return Math.min(widest, roster.size());
    }
}
