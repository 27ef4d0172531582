/**
 * REST boundary: controllers, request/response DTOs and exception mapping.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/contests/reconcile} - one contest, returns its outcome</li>
 *   <li>{@code POST /api/contests/reconcile-batch} - many contests processed in parallel</li>
 *   <li>{@code GET /ping} - liveness</li>
 * </ul>
 */
package com.electionlens.boothrecon.presentation;
