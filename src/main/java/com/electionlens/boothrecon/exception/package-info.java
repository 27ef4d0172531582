/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.electionlens.boothrecon.exception.BoothReconException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.electionlens.boothrecon.exception.InvalidContestDataException} - Thrown when
 *       official totals or declared postal figures are malformed</li>
 *   <li>{@link com.electionlens.boothrecon.exception.MappingFailedException} - Thrown when no
 *       column mapping passes validation within the retry budget</li>
 *   <li>{@link com.electionlens.boothrecon.exception.ReconciliationImpossibleException} - Thrown
 *       when booth sums cannot reach the official target without negative votes</li>
 * </ul>
 *
 * <p>The contest pipeline turns mapping and reconciliation failures into a FAILED outcome;
 * the REST boundary maps whatever escapes via {@code GlobalExceptionHandler}.
 *
 * @see com.electionlens.boothrecon.exception.BoothReconException
 */
package com.electionlens.boothrecon.exception;
