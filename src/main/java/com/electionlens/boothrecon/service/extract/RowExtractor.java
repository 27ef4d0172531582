package com.electionlens.boothrecon.service.extract;

import com.electionlens.boothrecon.domain.BoothId;
import com.electionlens.boothrecon.domain.ContestConfig;
import com.electionlens.boothrecon.domain.ContestInput;
import com.electionlens.boothrecon.domain.RawBoothRow;
import com.electionlens.boothrecon.domain.SkipReason;
import com.electionlens.boothrecon.domain.SkippedLine;
import com.electionlens.boothrecon.domain.SummaryColumn;
import com.electionlens.boothrecon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw text line into a {@link RawBoothRow}, or rejects it with a reason.
 *
 * <p>Steps:
 * <ol>
 *   <li>Reject blank lines and lines containing a configured header/footer marker</li>
 *   <li>Repair letter/digit confusions in numeric words ({@link OcrSubstitution})</li>
 *   <li>Tokenize into maximal digit runs; a leading word such as "12A" or "7A(W)" keeps its suffix</li>
 *   <li>Take the booth identifier from the first token, or the second when the first is a
 *       serial number that is not a known booth</li>
 *   <li>Drop vote tokens above the per-booth ceiling (likely concatenated numbers)</li>
 *   <li>Require at least {@link ContestConfig#quorum(int)} vote tokens; the first
 *       {@code candidates} tokens are candidate votes, up to four more are summary columns</li>
 * </ol>
 *
 * <p>Stateless and thread-safe: a pure function of the line and the contest.
 */
@Component
public class RowExtractor {

    private static final Logger LOG = LogManager.getLogger(RowExtractor.class);

    private static final Pattern SUFFIXED_NUMBER = Pattern.compile("^(\\d+)([A-Za-z](?:\\([A-Za-z]\\))?)$");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final SummaryColumn[] SUMMARY_ORDER = SummaryColumn.values();

    /**
     * Convenience form that drops the skip reason.
     *
     * @return the row, or empty if the line is not a data row
     */
    public Optional<RawBoothRow> extract(String line, ContestInput contest) {
        return Optional.ofNullable(extract(0, line, contest).row());
    }

    /**
     * Extracts one line.
     *
     * @param lineNumber 1-based position of the line, recorded on the row or skip
     * @param line       raw text (may be null)
     * @param contest    contest metadata: roster size, known booths, configuration
     * @return accepted row or recorded skip
     */
    public LineExtraction extract(int lineNumber, String line, ContestInput contest) {
        ContestConfig config = contest.config();
        if (line == null || line.isBlank()) {
            return skip(lineNumber, SkipReason.BLANK, line);
        }
        if (isHeader(line, config)) {
            return skip(lineNumber, SkipReason.HEADER, line);
        }

        List<Token> tokens = tokenize(OcrSubstitution.normalizedWords(line));
        if (tokens.isEmpty()) {
            return skip(lineNumber, SkipReason.NO_BOOTH_ID, line);
        }

        int boothTokenIndex = boothTokenIndex(tokens, contest.knownBoothIds());
        BoothId boothId = tokens.get(boothTokenIndex).asBoothId();
        if (boothId == null) {
            return skip(lineNumber, SkipReason.NO_BOOTH_ID, line);
        }

        List<Integer> values = new ArrayList<>();
        for (int i = boothTokenIndex + 1; i < tokens.size(); i++) {
            long v = tokens.get(i).value();
            if (v > config.maxVotesPerBooth()) {
                LOG.debug("Line {}: dropping implausible token {} (ceiling {})", lineNumber,
                        tokens.get(i).digits(), config.maxVotesPerBooth());
                continue;
            }
            values.add((int) v);
        }

        int candidates = contest.roster().size();
        if (values.size() < config.quorum(candidates)) {
            return skip(lineNumber, SkipReason.BELOW_QUORUM, line);
        }

        int voteColumns = Math.min(values.size(), candidates);
        Map<SummaryColumn, Integer> summary = new EnumMap<>(SummaryColumn.class);
        for (int i = voteColumns, s = 0; i < values.size() && s < SUMMARY_ORDER.length; i++, s++) {
            summary.put(SUMMARY_ORDER[s], values.get(i));
        }
        return LineExtraction.accepted(
                new RawBoothRow(lineNumber, boothId, values.subList(0, voteColumns), summary));
    }

    private static boolean isHeader(String line, ContestConfig config) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String marker : config.headerMarkers()) {
            if (!marker.isEmpty() && lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A row may start with "serial booth votes..." or "booth votes...". With no known booths
     * the first token is the booth; otherwise the first token wins if it is known, the second
     * if only it is known, and the first again if neither is.
     */
    private static int boothTokenIndex(List<Token> tokens, Set<BoothId> known) {
        if (known.isEmpty() || tokens.size() < 2) {
            return 0;
        }
        BoothId first = tokens.get(0).asBoothId();
        if (first != null && known.contains(first)) {
            return 0;
        }
        BoothId second = tokens.get(1).asBoothId();
        if (second != null && known.contains(second)) {
            return 1;
        }
        return 0;
    }

    private static List<Token> tokenize(List<String> words) {
        List<Token> tokens = new ArrayList<>();
        for (String word : words) {
            Matcher suffixed = SUFFIXED_NUMBER.matcher(word);
            if (suffixed.matches()) {
                tokens.add(new Token(suffixed.group(1), suffixed.group(2)));
                continue;
            }
            Matcher run = DIGIT_RUN.matcher(word);
            while (run.find()) {
                tokens.add(new Token(run.group(), ""));
            }
        }
        return tokens;
    }

    private static LineExtraction skip(int lineNumber, SkipReason reason, String line) {
        String preview = LogSanitizer.preview(line);
        LOG.debug("Line {} skipped: reason={}, preview='{}'", lineNumber, reason, preview);
        return LineExtraction.skipped(new SkippedLine(lineNumber, reason, preview));
    }

    /**
     * A maximal digit run, with the suffix of a word like "12A" or "7A(W)".
     */
    private record Token(String digits, String suffix) {

        private static final int MAX_DIGITS = 9;

        long value() {
            String trimmed = digits.replaceFirst("^0+(?=\\d)", "");
            return trimmed.length() > MAX_DIGITS ? Long.MAX_VALUE : Long.parseLong(trimmed);
        }

        BoothId asBoothId() {
            long v = value();
            if (v <= 0 || v > Integer.MAX_VALUE) {
                return null;
            }
            return new BoothId((int) v, suffix);
        }
    }
}
