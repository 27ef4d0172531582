package com.electionlens.boothrecon.domain;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partial injective function from extracted column index to official candidate index.
 *
 * <p>Built once per contest by a mapping strategy and applied to every row of that
 * contest. Candidates without a mapped column receive zero votes in the resulting
 * {@link BoothRecord}; columns without a candidate are ignored.
 */
public final class ColumnMapping {

    private final String strategy;
    private final int candidateCount;
    private final Map<Integer, Integer> columnToCandidate;

    private ColumnMapping(String strategy, int candidateCount, Map<Integer, Integer> columnToCandidate) {
        this.strategy = strategy;
        this.candidateCount = candidateCount;
        this.columnToCandidate = columnToCandidate;
    }

    /**
     * @param strategy          name of the strategy that produced the mapping
     * @param candidateCount    number of official candidates
     * @param columnToCandidate column index to candidate index
     * @throws IllegalArgumentException if two columns share a candidate or an index is out of range
     */
    public static ColumnMapping of(String strategy, int candidateCount, Map<Integer, Integer> columnToCandidate) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(columnToCandidate, "columnToCandidate");
        if (candidateCount < 0) {
            throw new IllegalArgumentException("candidateCount must not be negative");
        }
        Set<Integer> used = new HashSet<>();
        for (Map.Entry<Integer, Integer> e : columnToCandidate.entrySet()) {
            int column = e.getKey();
            int candidate = e.getValue();
            if (column < 0) {
                throw new IllegalArgumentException("Negative column index: " + column);
            }
            if (candidate < 0 || candidate >= candidateCount) {
                throw new IllegalArgumentException("Candidate index " + candidate
                        + " out of range [0," + candidateCount + ")");
            }
            if (!used.add(candidate)) {
                throw new IllegalArgumentException("Candidate " + candidate
                        + " is mapped from more than one column");
            }
        }
        return new ColumnMapping(strategy, candidateCount,
                Collections.unmodifiableMap(new TreeMap<>(columnToCandidate)));
    }

    public String strategy() {
        return strategy;
    }

    public int candidateCount() {
        return candidateCount;
    }

    /**
     * @return sorted, unmodifiable view of column to candidate assignments
     */
    public Map<Integer, Integer> assignments() {
        return columnToCandidate;
    }

    public OptionalInt candidateFor(int column) {
        Integer c = columnToCandidate.get(column);
        return c == null ? OptionalInt.empty() : OptionalInt.of(c);
    }

    public int mappedCount() {
        return columnToCandidate.size();
    }

    /**
     * @return candidate indices that no column maps to
     */
    public Set<Integer> unmappedCandidates() {
        Set<Integer> result = new TreeSet<>();
        for (int i = 0; i < candidateCount; i++) {
            result.add(i);
        }
        result.removeAll(columnToCandidate.values());
        return Collections.unmodifiableSet(result);
    }

    /**
     * Rearranges one raw row into official candidate order.
     */
    public BoothRecord apply(RawBoothRow row) {
        int[] votes = new int[candidateCount];
        for (Map.Entry<Integer, Integer> e : columnToCandidate.entrySet()) {
            int column = e.getKey();
            if (column < row.columnCount()) {
                votes[e.getValue()] = row.token(column);
            }
        }
        return BoothRecord.of(row.boothId(), votes);
    }

    public List<BoothRecord> applyAll(List<RawBoothRow> rows) {
        return rows.stream().map(this::apply).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnMapping other)) {
            return false;
        }
        return candidateCount == other.candidateCount
                && strategy.equals(other.strategy)
                && columnToCandidate.equals(other.columnToCandidate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, candidateCount, columnToCandidate);
    }

    @Override
    public String toString() {
        return strategy + columnToCandidate;
    }
}
