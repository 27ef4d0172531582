package com.electionlens.boothrecon.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One official candidate as supplied by the caller.
 *
 * @param name        display name
 * @param party       party code ("NOTA" marks the none-of-the-above slot)
 * @param votes       official total
 * @param postalVotes declared out-of-booth votes from the sheet, or {@code null} if not read
 */
public record CandidateEntry(
        @NotBlank String name,
        @NotBlank String party,
        @NotNull @Min(0) Integer votes,
        @Min(0) Integer postalVotes
) {}
