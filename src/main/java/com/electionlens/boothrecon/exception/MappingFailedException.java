package com.electionlens.boothrecon.exception;

import com.electionlens.boothrecon.domain.ColumnMapping;
import com.electionlens.boothrecon.domain.MappingAttempt;
import com.electionlens.boothrecon.domain.ValidationReport;

import java.util.List;

/**
 * Thrown when every mapping strategy within the retry budget produced records that failed
 * validation. Carries the best attempt for human review.
 */
public class MappingFailedException extends BoothReconException {

    private final transient MappingAttempt bestAttempt;
    private final transient List<MappingAttempt> attempts;

    public MappingFailedException(String contestId, MappingAttempt bestAttempt, List<MappingAttempt> attempts) {
        super("No column mapping passed validation for contest " + contestId + " after "
                + attempts.size() + " attempt(s); best was " + bestAttempt.mapping());
        this.bestAttempt = bestAttempt;
        this.attempts = List.copyOf(attempts);
    }

    public MappingAttempt getBestAttempt() {
        return bestAttempt;
    }

    public ColumnMapping getBestMapping() {
        return bestAttempt.mapping();
    }

    public ValidationReport getBestReport() {
        return bestAttempt.report();
    }

    public List<MappingAttempt> getAttempts() {
        return attempts;
    }
}
