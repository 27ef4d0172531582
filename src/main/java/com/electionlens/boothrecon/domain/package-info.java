/**
 * Immutable domain model of booth-level result reconciliation.
 *
 * <p>Flow of values through one contest run:
 * {@link com.electionlens.boothrecon.domain.RawBoothRow} (extracted tokens) →
 * {@link com.electionlens.boothrecon.domain.ColumnMapping} (column identity) →
 * {@link com.electionlens.boothrecon.domain.BoothRecord} (official candidate order) →
 * {@link com.electionlens.boothrecon.domain.ValidationReport} →
 * {@link com.electionlens.boothrecon.domain.ReconciliationResult}.
 *
 * <p>The {@link com.electionlens.boothrecon.domain.CandidateRoster} is loaded once per contest
 * and shared read-only; every other value is scoped to a single run.
 */
package com.electionlens.boothrecon.domain;
