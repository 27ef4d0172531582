/**
 * Service layer of the booth reconciler.
 *
 * <p>Sub-packages, in pipeline order:
 * <ul>
 *   <li>{@code service.extract} - raw text line to booth row</li>
 *   <li>{@code service.mapping} - column-to-candidate inference with ordered fallback strategies</li>
 *   <li>{@code service.validation} - structural and cross-total checks on mapped records</li>
 *   <li>{@code service.reconcile} - exact agreement of booth sums with official totals</li>
 *   <li>{@code service.orchestration} - per-contest pipeline, state machine and batch runner</li>
 *   <li>{@code service.metrics}, {@code service.events} - Micrometer counters and outcome audit log</li>
 * </ul>
 *
 * <p>Services are stateless Spring beans with constructor injection, throw domain exceptions
 * rather than HTTP ones, and may be called concurrently for different contests.
 */
package com.electionlens.boothrecon.service;
