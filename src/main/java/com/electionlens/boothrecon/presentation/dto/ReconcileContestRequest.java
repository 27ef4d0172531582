package com.electionlens.boothrecon.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Body of {@code POST /api/contests/reconcile}.
 *
 * @param contestId         caller-chosen identifier
 * @param lines             raw text lines in page order
 * @param candidates        official candidates, any order
 * @param knownBoothIds     valid booth identifiers ("12", "12A"), optional
 * @param mappingStrategies strategy order override, optional
 * @param maxVotesPerBooth  override, optional
 * @param mappingCeiling    override, optional
 * @param retryBudget       override, optional
 */
public record ReconcileContestRequest(
        @NotBlank String contestId,
        @NotNull List<String> lines,
        @NotEmpty List<@Valid CandidateEntry> candidates,
        List<String> knownBoothIds,
        List<String> mappingStrategies,
        Integer maxVotesPerBooth,
        Double mappingCeiling,
        Integer retryBudget
) {}
