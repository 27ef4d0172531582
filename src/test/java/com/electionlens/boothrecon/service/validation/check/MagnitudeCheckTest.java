package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.ContestConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.electionlens.boothrecon.testutil.ContestFixtures.record;
import static com.electionlens.boothrecon.testutil.ContestFixtures.roster;
import static org.assertj.core.api.Assertions.assertThat;

class MagnitudeCheckTest {

    private final MagnitudeCheck check = new MagnitudeCheck();

    @Test
    void acceptsValuesUpToCeiling() {
        assertThat(check.check(List.of(record(1, 2000, 0)), roster(3000, 100), ContestConfig.defaults())).isEmpty();
    }

    @Test
    void rejectsValuesAboveCeilingAndNegatives() {
        var findings = check.check(List.of(record(1, 2001, -1)), roster(3000, 100), ContestConfig.defaults());

        assertThat(findings).hasSize(2);
        assertThat(findings).allMatch(f -> f.isFailure());
        assertThat(findings.get(0).message()).contains("exceeds ceiling 2000");
        assertThat(findings.get(1).message()).contains("negative");
    }

    @Test
    void ceilingFollowsContestConfig() {
        ContestConfig tight = ContestConfig.defaults().withOverrides(1200, null, null);

        assertThat(check.check(List.of(record(1, 1300, 0)), roster(3000, 100), tight)).hasSize(1);
    }
}
