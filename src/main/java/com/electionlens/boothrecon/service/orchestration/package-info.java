/**
 * Runs contests end to end.
 *
 * <ul>
 *   <li>{@link com.electionlens.boothrecon.service.orchestration.ContestPipeline} - one contest,
 *       extraction through reconciliation, always ending RECONCILED or FAILED</li>
 *   <li>{@link com.electionlens.boothrecon.service.orchestration.ContestStateMachine} - legal
 *       lifecycle transitions of a contest run</li>
 *   <li>{@link com.electionlens.boothrecon.service.orchestration.ParallelContestService} - many
 *       contests on the bounded {@code contestExecutor}</li>
 * </ul>
 *
 * <p>Outcomes are announced with Spring application events from the {@code event} sub-package.
 */
package com.electionlens.boothrecon.service.orchestration;
