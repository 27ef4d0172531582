package com.electionlens.boothrecon.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Body of {@code POST /api/contests/reconcile-batch}.
 */
public record ReconcileBatchRequest(@NotEmpty List<@Valid ReconcileContestRequest> contests) {}
