package com.electionlens.boothrecon.config.properties;

import com.electionlens.boothrecon.domain.CandidateRoster;
import com.electionlens.boothrecon.domain.ContestConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Default tuning constants for every contest, bound from {@code contest.*}.
 *
 * <p>Unset keys fall back to the {@link ContestConfig} defaults. Out-of-range values fail
 * start-up with an {@link IllegalArgumentException} naming the key.
 */
@Validated
@ConfigurationProperties(prefix = "contest")
public class ContestProperties {

    /** Ceiling for a single booth vote value (max plausible electors per booth). */
    @Min(1)
    private final int maxVotesPerBooth;

    /** Relative booth-sum error above which the cross-total check warns (0..1). */
    @Min(0)
    @Max(1)
    private final double crossTotalWarningThreshold;

    /** Relative booth-sum error above which the cross-total check fails (0..1). */
    @Min(0)
    @Max(1)
    private final double crossTotalFailureThreshold;

    @Min(1)
    private final int crossTotalCandidates;

    /** Vote columns a data row may be missing before it is rejected. */
    @Min(0)
    private final int quorumSlack;

    /** Relative acceptance ceiling of the vote-total strategies (0..1). */
    @Min(0)
    @Max(1)
    private final double mappingCeiling;

    @Min(0)
    private final int mappingSlackVotes;

    /** Maximum mapping attempts per contest. */
    @Min(1)
    private final int retryBudget;

    @Min(1)
    private final int selfReferenceColumns;

    @NotEmpty
    private final List<String> mappingStrategies;

    private final List<String> headerMarkers;

    /** Party code of the none-of-the-above slot. */
    @NotBlank
    private final String noneOfTheAboveParty;

    @ConstructorBinding
    public ContestProperties(Integer maxVotesPerBooth,
                             Double crossTotalWarningThreshold,
                             Double crossTotalFailureThreshold,
                             Integer crossTotalCandidates,
                             Integer quorumSlack,
                             Double mappingCeiling,
                             Integer mappingSlackVotes,
                             Integer retryBudget,
                             Integer selfReferenceColumns,
                             List<String> mappingStrategies,
                             List<String> headerMarkers,
                             String noneOfTheAboveParty) {
        this.maxVotesPerBooth = atLeast(orDefault(maxVotesPerBooth, ContestConfig.DEFAULT_MAX_VOTES_PER_BOOTH),
                1, "contest.max-votes-per-booth");
        this.crossTotalWarningThreshold = fraction(orDefault(crossTotalWarningThreshold,
                ContestConfig.DEFAULT_CROSS_TOTAL_WARNING_THRESHOLD), "contest.cross-total-warning-threshold");
        this.crossTotalFailureThreshold = fraction(orDefault(crossTotalFailureThreshold,
                ContestConfig.DEFAULT_CROSS_TOTAL_FAILURE_THRESHOLD), "contest.cross-total-failure-threshold");
        if (this.crossTotalWarningThreshold > this.crossTotalFailureThreshold) {
            throw new IllegalArgumentException("contest.cross-total-warning-threshold must not exceed "
                    + "contest.cross-total-failure-threshold");
        }
        this.crossTotalCandidates = atLeast(orDefault(crossTotalCandidates,
                ContestConfig.DEFAULT_CROSS_TOTAL_CANDIDATES), 1, "contest.cross-total-candidates");
        this.quorumSlack = atLeast(orDefault(quorumSlack, ContestConfig.DEFAULT_QUORUM_SLACK),
                0, "contest.quorum-slack");
        this.mappingCeiling = fraction(orDefault(mappingCeiling, ContestConfig.DEFAULT_MAPPING_CEILING),
                "contest.mapping-ceiling");
        this.mappingSlackVotes = atLeast(orDefault(mappingSlackVotes, ContestConfig.DEFAULT_MAPPING_SLACK_VOTES),
                0, "contest.mapping-slack-votes");
        this.retryBudget = atLeast(orDefault(retryBudget, ContestConfig.DEFAULT_RETRY_BUDGET),
                1, "contest.retry-budget");
        this.selfReferenceColumns = atLeast(orDefault(selfReferenceColumns,
                ContestConfig.DEFAULT_SELF_REFERENCE_COLUMNS), 1, "contest.self-reference-columns");
        this.mappingStrategies = mappingStrategies == null || mappingStrategies.isEmpty()
                ? ContestConfig.DEFAULT_MAPPING_STRATEGIES
                : List.copyOf(mappingStrategies);
        this.headerMarkers = headerMarkers == null ? ContestConfig.DEFAULT_HEADER_MARKERS : List.copyOf(headerMarkers);
        this.noneOfTheAboveParty = noneOfTheAboveParty == null || noneOfTheAboveParty.isBlank()
                ? CandidateRoster.DEFAULT_NONE_OF_THE_ABOVE_PARTY
                : noneOfTheAboveParty.trim();
    }

    /**
     * All defaults.
     */
    public ContestProperties() {
        this(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * The default configuration handed to every contest.
     */
    public ContestConfig toContestConfig() {
        return new ContestConfig(maxVotesPerBooth, crossTotalWarningThreshold, crossTotalFailureThreshold,
                crossTotalCandidates, quorumSlack, mappingCeiling, mappingSlackVotes, retryBudget,
                selfReferenceColumns, mappingStrategies, headerMarkers);
    }

    private static <T> T orDefault(T value, T fallback) {
        return value == null ? fallback : value;
    }

    private static int atLeast(int value, int min, String key) {
        if (value < min) {
            throw new IllegalArgumentException(key + " must be >= " + min + ", got: " + value);
        }
        return value;
    }

    private static double fraction(double value, String key) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(key + " must be in [0,1], got: " + value);
        }
        return value;
    }

    public int getMaxVotesPerBooth() {
        return maxVotesPerBooth;
    }

    public double getCrossTotalWarningThreshold() {
        return crossTotalWarningThreshold;
    }

    public double getCrossTotalFailureThreshold() {
        return crossTotalFailureThreshold;
    }

    public int getCrossTotalCandidates() {
        return crossTotalCandidates;
    }

    public int getQuorumSlack() {
        return quorumSlack;
    }

    public double getMappingCeiling() {
        return mappingCeiling;
    }

    public int getMappingSlackVotes() {
        return mappingSlackVotes;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public int getSelfReferenceColumns() {
        return selfReferenceColumns;
    }

    public List<String> getMappingStrategies() {
        return mappingStrategies;
    }

    public List<String> getHeaderMarkers() {
        return headerMarkers;
    }

    public String getNoneOfTheAboveParty() {
        return noneOfTheAboveParty;
    }
}
