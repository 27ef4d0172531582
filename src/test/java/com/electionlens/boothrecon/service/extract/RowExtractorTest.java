package com.electionlens.boothrecon.service.extract;

import com.electionlens.boothrecon.domain.BoothId;
import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.domain.SkipReason;
import com.electionlens.boothrecon.domain.SummaryColumn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.electionlens.boothrecon.testutil.ContestFixtures.roster;
import static org.assertj.core.api.Assertions.assertThat;

class RowExtractorTest {

    private RowExtractor extractor;
    private CandidateRoster threeCandidates;
    private ContestInput contest;

    @BeforeEach
    void setUp() {
        extractor = new RowExtractor();
        threeCandidates = roster(300, 200, 100);
        contest = ContestInput.of("T-1", List.of(), threeCandidates, ContestConfig.defaults());
    }

    @Test
    void extractsBoothAndVotes() {
        RawBoothRow row = extractor.extract(7, "12 45 30 20", contest).row();

        assertThat(row.lineNumber()).isEqualTo(7);
        assertThat(row.boothId()).isEqualTo(BoothId.of(12));
        assertThat(row.tokens()).containsExactly(45, 30, 20);
        assertThat(row.summary()).isEmpty();
    }

    @Test
    void keepsTrailingSummaryColumnsInFixedOrder() {
        RawBoothRow row = extractor.extract(1, "12 45 30 20 95 3 1 99", contest).row();

        assertThat(row.tokens()).containsExactly(45, 30, 20);
        assertThat(row.summary())
                .containsEntry(SummaryColumn.VALID_TOTAL, 95)
                .containsEntry(SummaryColumn.REJECTED, 3)
                .containsEntry(SummaryColumn.NONE_OF_THE_ABOVE, 1)
                .containsEntry(SummaryColumn.GRAND_TOTAL, 99);
    }

    @Test
    void repairsOcrConfusionsBeforeTokenizing() {
        RawBoothRow row = extractor.extract("1O 4S 3O 2O", contest).orElseThrow();

        assertThat(row.boothId()).isEqualTo(BoothId.of(10));
        assertThat(row.tokens()).containsExactly(45, 30, 20);
    }

    @Test
    void keepsBoothSuffix() {
        RawBoothRow row = extractor.extract("12A 40 30 20", contest).orElseThrow();

        assertThat(row.boothId()).hasToString("12A");
    }

    @Test
    void keepsParenthesisedWomenStationSuffix() {
        RawBoothRow row = extractor.extract(1, "7A(W) 40 30 20", contest).row();

        assertThat(row.boothId()).isEqualTo(BoothId.parse("7A(W)"));
        assertThat(row.boothId()).isNotEqualTo(BoothId.of(7));
        assertThat(row.tokens()).containsExactly(40, 30, 20);
    }

    @Test
    void prefersKnownBoothOverLeadingSerialNumber() {
        ContestInput withKnown = new ContestInput("T-1", List.of(), threeCandidates,
                Set.of(BoothId.of(12)), List.of(), ContestConfig.defaults());

        RawBoothRow row = extractor.extract("3 12 45 30 20", withKnown).orElseThrow();

        assertThat(row.boothId()).isEqualTo(BoothId.of(12));
        assertThat(row.tokens()).containsExactly(45, 30, 20);
    }

    @Test
    void firstTokenIsBoothWhenNoBoothsAreKnown() {
        RawBoothRow row = extractor.extract("3 12 45 30 20", contest).orElseThrow();

        assertThat(row.boothId()).isEqualTo(BoothId.of(3));
        assertThat(row.tokens()).containsExactly(12, 45, 30);
        assertThat(row.summary()).containsEntry(SummaryColumn.VALID_TOTAL, 20);
    }

    @Test
    void dropsTokensAboveCeiling() {
        RawBoothRow row = extractor.extract("5 45 30000 30 20", contest).orElseThrow();

        assertThat(row.tokens()).containsExactly(45, 30, 20);
    }

    @Test
    void ignoresWordsAroundNumbers() {
        RawBoothRow row = extractor.extract("Booth 12: 45 30 20", contest).orElseThrow();

        assertThat(row.boothId()).isEqualTo(BoothId.of(12));
        assertThat(row.tokens()).containsExactly(45, 30, 20);
    }

    @Test
    void rejectsBlankAndHeaderLines() {
        assertThat(extractor.extract(1, "   ", contest).skipped().reason()).isEqualTo(SkipReason.BLANK);
        assertThat(extractor.extract(2, "Sl.No Polling Station A B C Total", contest).skipped().reason())
                .isEqualTo(SkipReason.HEADER);
        assertThat(extractor.extract(3, "Page 4 of 9", contest).skipped().reason())
                .isEqualTo(SkipReason.HEADER);
    }

    @Test
    void rejectsLinesWithoutBoothNumber() {
        assertThat(extractor.extract(1, "abc def", contest).skipped().reason()).isEqualTo(SkipReason.NO_BOOTH_ID);
        assertThat(extractor.extract(2, "0 45 30 20", contest).skipped().reason()).isEqualTo(SkipReason.NO_BOOTH_ID);
    }

    @Test
    void rejectsRowsBelowQuorum() {
        ContestInput fourCandidates = ContestInput.of("T-2", List.of(), roster(400, 300, 200, 100),
                ContestConfig.defaults());

        LineExtraction extraction = extractor.extract(9, "7 45", fourCandidates);

        assertThat(extraction.isAccepted()).isFalse();
        assertThat(extraction.skipped().reason()).isEqualTo(SkipReason.BELOW_QUORUM);
        assertThat(extraction.skipped().lineNumber()).isEqualTo(9);
        assertThat(extractor.extract(10, "7 45 30", fourCandidates).isAccepted()).isTrue();
    }

    @Test
    void skipRecordsTruncatedPreview() {
        String noisy = "page " + "x".repeat(200);

        LineExtraction extraction = extractor.extract(1, noisy, contest);

        assertThat(extraction.skipped().preview()).hasSize(80).startsWith("page x");
    }
}
