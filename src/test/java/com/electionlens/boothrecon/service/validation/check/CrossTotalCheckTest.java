package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.electionlens.boothrecon.testutil.ContestFixtures.record;
import static com.electionlens.boothrecon.testutil.ContestFixtures.roster;
import static org.assertj.core.api.Assertions.assertThat;

class CrossTotalCheckTest {

    private final CrossTotalCheck check = new CrossTotalCheck();
    private final CandidateRoster roster = roster(1000, 500, 200, 50);
    private final ContestConfig config = ContestConfig.defaults();

    @Test
    void exactTotalsProduceNoFindings() {
        assertThat(check.check(List.of(record(1, 600, 300, 100, 50), record(2, 400, 200, 100, 0)), roster, config))
                .isEmpty();
    }

    @Test
    void errorAtWarningThresholdIsAccepted() {
        assertThat(check.check(List.of(record(1, 980, 500, 200, 50)), roster, config)).isEmpty();
    }

    @Test
    void errorBetweenThresholdsIsWarning() {
        List<ValidationFinding> findings = check.check(List.of(record(1, 970, 500, 200, 50)), roster, config);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).severity()).isEqualTo(ValidationFinding.Severity.WARNING);
        assertThat(findings.get(0).message()).contains("C0").contains("3.0%");
    }

    @Test
    void errorAboveFailureThresholdIsFailure() {
        List<ValidationFinding> findings = check.check(List.of(record(1, 1000, 450, 200, 50)), roster, config);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.isFailure()).isTrue();
            assertThat(f.message()).contains("C1");
        });
    }

    @Test
    void onlyTopCandidatesAreCompared() {
        assertThat(check.check(List.of(record(1, 1000, 500, 200, 0)), roster, config)).isEmpty();
    }

    @Test
    void relativeErrorOfZeroOfficialTotal() {
        assertThat(CrossTotalCheck.relativeError(0, 0)).isZero();
        assertThat(CrossTotalCheck.relativeError(5, 0)).isEqualTo(1.0);
    }
}
