package com.electionlens.boothrecon.service.validation.check;

import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ValidationFinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.electionlens.boothrecon.testutil.ContestFixtures.record;
import static com.electionlens.boothrecon.testutil.ContestFixtures.roster;
import static org.assertj.core.api.Assertions.assertThat;

class StructureCheckTest {

    private final StructureCheck check = new StructureCheck();

    @Test
    void wellFormedRecordsPass() {
        assertThat(check.check(List.of(record(1, 1, 2), record(2, 3, 4)), roster(10, 5), ContestConfig.defaults()))
                .isEmpty();
    }

    @Test
    void flagsWrongVoteCountAndRepeatedBooth() {
        List<ValidationFinding> findings = check.check(
                List.of(record(1, 1, 2, 3), record(2, 3, 4), record(2, 5, 6)), roster(10, 5), ContestConfig.defaults());

        assertThat(findings).extracting(ValidationFinding::message)
                .containsExactly("booth 1 has 3 vote columns, expected 2", "booth 2 appears more than once");
        assertThat(findings).allMatch(ValidationFinding::isFailure);
    }

    @Test
    void noRecordsIsAFailure() {
        assertThat(check.check(List.of(), roster(10, 5), ContestConfig.defaults()))
                .singleElement()
                .satisfies(f -> assertThat(f.isFailure()).isTrue());
    }
}
