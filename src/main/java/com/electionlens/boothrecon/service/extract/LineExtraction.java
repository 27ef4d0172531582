package com.electionlens.boothrecon.service.extract;

import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.domain.SkippedLine;

/**
 * Verdict of the row extractor for a single line: exactly one of {@code row} and
 * {@code skipped} is set.
 */
public record LineExtraction(RawBoothRow row, SkippedLine skipped) {

    public LineExtraction {
        if ((row == null) == (skipped == null)) {
            throw new IllegalArgumentException("Exactly one of row and skipped must be set");
        }
    }

    static LineExtraction accepted(RawBoothRow row) {
        return new LineExtraction(row, null);
    }

    static LineExtraction skipped(SkippedLine skipped) {
        return new LineExtraction(null, skipped);
    }

    public boolean isAccepted() {
        return row != null;
    }
}
