package com.electionlens.boothrecon.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-contest tuning constants, passed explicitly into every pipeline step.
 *
 * <p>Defaults come from {@code contest.*} properties; callers may derive a contest-specific
 * copy with {@link #withOverrides(Integer, Double, Integer)}.
 *
 * @param maxVotesPerBooth           ceiling for a single booth value (token filter and magnitude check)
 * @param crossTotalWarningThreshold relative error above which the cross-total check warns
 * @param crossTotalFailureThreshold relative error above which the cross-total check fails
 * @param crossTotalCandidates       number of top candidates compared by the cross-total check
 * @param quorumSlack                columns allowed to be missing from a data row
 * @param mappingCeiling             relative acceptance ceiling of the vote-total strategies
 * @param mappingSlackVotes          additive acceptance slack for low-vote candidates
 * @param retryBudget                maximum number of mapping attempts
 * @param selfReferenceColumns       leading vote columns scanned for a leaked booth number
 * @param mappingStrategies          strategy names, tried in order
 * @param headerMarkers              lower-case substrings that mark header/footer lines
 */
public record ContestConfig(
        int maxVotesPerBooth,
        double crossTotalWarningThreshold,
        double crossTotalFailureThreshold,
        int crossTotalCandidates,
        int quorumSlack,
        double mappingCeiling,
        int mappingSlackVotes,
        int retryBudget,
        int selfReferenceColumns,
        List<String> mappingStrategies,
        List<String> headerMarkers
) {

    public static final int DEFAULT_MAX_VOTES_PER_BOOTH = 2000;
    public static final double DEFAULT_CROSS_TOTAL_WARNING_THRESHOLD = 0.02;
    public static final double DEFAULT_CROSS_TOTAL_FAILURE_THRESHOLD = 0.05;
    public static final int DEFAULT_CROSS_TOTAL_CANDIDATES = 3;
    public static final int DEFAULT_QUORUM_SLACK = 2;
    public static final double DEFAULT_MAPPING_CEILING = 0.30;
    public static final int DEFAULT_MAPPING_SLACK_VOTES = 50;
    public static final int DEFAULT_RETRY_BUDGET = 3;
    public static final int DEFAULT_SELF_REFERENCE_COLUMNS = 3;
    public static final List<String> DEFAULT_MAPPING_STRATEGIES =
            List.of("positional", "vote-total", "scaled-vote-total");
    public static final List<String> DEFAULT_HEADER_MARKERS = List.of(
            "polling", "station", "sl.no", "serial", "total", "candidate", "page",
            "valid votes", "rejected", "tendered", "form 20", "nota");

    public ContestConfig {
        requirePositive(maxVotesPerBooth, "maxVotesPerBooth");
        requireFraction(crossTotalWarningThreshold, "crossTotalWarningThreshold");
        requireFraction(crossTotalFailureThreshold, "crossTotalFailureThreshold");
        if (crossTotalWarningThreshold > crossTotalFailureThreshold) {
            throw new IllegalArgumentException("crossTotalWarningThreshold (" + crossTotalWarningThreshold
                    + ") must not exceed crossTotalFailureThreshold (" + crossTotalFailureThreshold + ")");
        }
        requirePositive(crossTotalCandidates, "crossTotalCandidates");
        if (quorumSlack < 0) {
            throw new IllegalArgumentException("quorumSlack must not be negative, got: " + quorumSlack);
        }
        requireFraction(mappingCeiling, "mappingCeiling");
        if (mappingSlackVotes < 0) {
            throw new IllegalArgumentException("mappingSlackVotes must not be negative, got: " + mappingSlackVotes);
        }
        requirePositive(retryBudget, "retryBudget");
        requirePositive(selfReferenceColumns, "selfReferenceColumns");
        Objects.requireNonNull(mappingStrategies, "mappingStrategies");
        if (mappingStrategies.isEmpty()) {
            throw new IllegalArgumentException("mappingStrategies must name at least one strategy");
        }
        mappingStrategies = List.copyOf(mappingStrategies);
        headerMarkers = Objects.requireNonNull(headerMarkers, "headerMarkers").stream()
                .map(m -> m.toLowerCase(Locale.ROOT))
                .toList();
    }

    public static ContestConfig defaults() {
        return new ContestConfig(
                DEFAULT_MAX_VOTES_PER_BOOTH,
                DEFAULT_CROSS_TOTAL_WARNING_THRESHOLD,
                DEFAULT_CROSS_TOTAL_FAILURE_THRESHOLD,
                DEFAULT_CROSS_TOTAL_CANDIDATES,
                DEFAULT_QUORUM_SLACK,
                DEFAULT_MAPPING_CEILING,
                DEFAULT_MAPPING_SLACK_VOTES,
                DEFAULT_RETRY_BUDGET,
                DEFAULT_SELF_REFERENCE_COLUMNS,
                DEFAULT_MAPPING_STRATEGIES,
                DEFAULT_HEADER_MARKERS);
    }

    /**
     * Returns a copy with the given values replaced; {@code null} keeps the current value.
     */
    public ContestConfig withOverrides(Integer maxVotesPerBooth, Double mappingCeiling, Integer retryBudget) {
        return new ContestConfig(
                maxVotesPerBooth == null ? this.maxVotesPerBooth : maxVotesPerBooth,
                crossTotalWarningThreshold,
                crossTotalFailureThreshold,
                crossTotalCandidates,
                quorumSlack,
                mappingCeiling == null ? this.mappingCeiling : mappingCeiling,
                mappingSlackVotes,
                retryBudget == null ? this.retryBudget : retryBudget,
                selfReferenceColumns,
                mappingStrategies,
                headerMarkers);
    }

    public ContestConfig withMappingStrategies(List<String> strategies) {
        return new ContestConfig(maxVotesPerBooth, crossTotalWarningThreshold, crossTotalFailureThreshold,
                crossTotalCandidates, quorumSlack, mappingCeiling, mappingSlackVotes, retryBudget,
                selfReferenceColumns, strategies, headerMarkers);
    }

    /**
     * Minimum number of vote tokens a data row must carry.
     */
    public int quorum(int candidateCount) {
        return Math.max(1, candidateCount - quorumSlack);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    private static void requireFraction(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0,1], got: " + value);
        }
    }
}
