package com.electionlens.boothrecon.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoothIdTest {

    @Test
    void parsesPlainNumberAndDropsLeadingZeros() {
        assertThat(BoothId.parse("007")).isEqualTo(BoothId.of(7));
        assertThat(BoothId.parse(" 12 ").toString()).isEqualTo("12");
    }

    @Test
    void parsesSuffixAndUpperCasesIt() {
        BoothId id = BoothId.parse("12w");

        assertThat(id.number()).isEqualTo(12);
        assertThat(id.suffix()).isEqualTo("W");
        assertThat(id).hasToString("12W");
    }

    @Test
    void parsesParenthesisedSuffix() {
        BoothId id = BoothId.parse("14a(w)");

        assertThat(id.number()).isEqualTo(14);
        assertThat(id.suffix()).isEqualTo("A(W)");
        assertThat(id).hasToString("14A(W)");
        assertThatThrownBy(() -> BoothId.parse("14(W)"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonIdentifiers() {
        assertThatThrownBy(() -> BoothId.parse("A12"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("A12");
        assertThatThrownBy(() -> BoothId.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ordersNumericallyThenBySuffix() {
        List<BoothId> ids = new ArrayList<>(List.of(
                BoothId.parse("12A"), BoothId.of(3), BoothId.of(12), BoothId.parse("100"), BoothId.parse("12M"),
                BoothId.parse("12A(W)")));
        Collections.sort(ids);

        assertThat(ids).extracting(BoothId::toString)
                .containsExactly("3", "12", "12A", "12A(W)", "12M", "100");
    }

    @Test
    void suffixedAndPlainBoothsAreDistinct() {
        assertThat(BoothId.parse("12A")).isNotEqualTo(BoothId.of(12));
        assertThat(BoothId.parse("12a")).isEqualTo(BoothId.parse("12A"));
    }
}
