/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/contests/reconcile} - one contest</li>
 *   <li>{@code POST /api/contests/reconcile-batch} - many contests, processed in parallel</li>
 *   <li>{@code GET /ping} - liveness</li>
 * </ul>
 *
 * <p>Controllers translate request DTOs into domain input and leave errors to
 * {@code GlobalExceptionHandler}.
 */
package com.electionlens.boothrecon.presentation.controller;
