package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.electionlens.boothrecon.testutil.ContestFixtures.record;
import static com.electionlens.boothrecon.testutil.ContestFixtures.roster;
import static org.assertj.core.api.Assertions.assertThat;

class SelfReferenceCheckTest {

    private final SelfReferenceCheck check = new SelfReferenceCheck();
    private final CandidateRoster roster = roster(900, 500, 300, 100);
    private final ContestConfig config = ContestConfig.defaults();

    @Test
    void flagsBoothNumberInFirstVoteColumn() {
        List<ValidationFinding> findings = check.check(List.of(record(12, 12, 45, 30, 0)), roster, config);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).isFailure()).isTrue();
        assertThat(findings.get(0).message()).contains("booth 12");
    }

    @Test
    void flagsEveryBoothNumberInAnyOfTheLeadingColumns() {
        for (int booth = 1; booth <= 300; booth++) {
            for (int column = 0; column < 3; column++) {
                int[] votes = {booth + 1, booth + 2, booth + 3, 0};
                votes[column] = booth;
                assertThat(check.check(List.of(record(booth, votes)), roster, config))
                        .as("booth %d in column %d", booth, column)
                        .hasSize(1);
            }
        }
    }

    @Test
    void ignoresBoothNumberBeyondScannedColumns() {
        assertThat(check.check(List.of(record(12, 45, 30, 20, 12)), roster, config)).isEmpty();
    }

    @Test
    void passesCleanRecords() {
        assertThat(check.check(List.of(record(1, 400, 200, 100, 50), record(2, 500, 300, 200, 50)), roster, config))
                .isEmpty();
    }
}
