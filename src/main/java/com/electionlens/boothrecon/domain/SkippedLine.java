package com.electionlens.boothrecon.domain;

/**
 * A source line that did not become a booth row.
 *
 * @param lineNumber 1-based line position
 * @param reason     why it was dropped
 * @param preview    truncated line text for audit
 */
public record SkippedLine(int lineNumber, SkipReason reason, String preview) {
}
