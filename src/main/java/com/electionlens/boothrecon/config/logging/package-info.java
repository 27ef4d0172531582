/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - identifier of each HTTP request, set by
 *       {@link com.electionlens.boothrecon.config.logging.MdcFilter}</li>
 *   <li>{@code contestId} - contest being processed, set by the contest pipeline and carried
 *       to worker threads by the contest executor</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 10:14:07.311 [contest-pool-1] [requestId] [contestId] LEVEL logger.name - message
 * </pre>
 */
package com.electionlens.boothrecon.config.logging;
