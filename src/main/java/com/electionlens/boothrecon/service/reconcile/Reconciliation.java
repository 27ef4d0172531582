package com.electionlens.boothrecon.service.reconcile;

import com.electionlens.boothrecon.domain.BoothRecord;
import com.electionlens.boothrecon.domain.ReconciliationResult;

import java.util.List;
import java.util.Objects;

/**
 * Adjusted booth records (in booth order) together with the per-candidate result.
 */
public record Reconciliation(List<BoothRecord> records, ReconciliationResult result) {

    public Reconciliation {
        records = List.copyOf(records);
        Objects.requireNonNull(result, "result");
    }
}
