package com.electionlens.boothrecon.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One extracted data row before column identity is known.
 *
 * @param lineNumber 1-based position of the source line within the contest
 * @param boothId    booth identifier found at the start of the row
 * @param tokens     candidate-vote tokens, left to right as printed
 * @param summary    trailing summary values that were present (valid total, rejected, ...)
 */
public record RawBoothRow(
        int lineNumber,
        BoothId boothId,
        List<Integer> tokens,
        Map<SummaryColumn, Integer> summary
) {

    public RawBoothRow {
        Objects.requireNonNull(boothId, "boothId");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        summary = summary == null || summary.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(summary));
    }

    public int columnCount() {
        return tokens.size();
    }

    public int token(int column) {
        return tokens.get(column);
    }
}
