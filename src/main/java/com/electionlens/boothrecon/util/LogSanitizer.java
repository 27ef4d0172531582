package com.electionlens.boothrecon.util;

/** Utility for log-safe previews of raw extracted text. */
public final class LogSanitizer {

    /** Default preview length for raw lines in logs and skip records. */
    public static final int LINE_PREVIEW_CHARS = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Collapses runs of whitespace and truncates to {@link #LINE_PREVIEW_CHARS}.
     */
    public static String preview(String line) {
        if (line == null) {
            return "";
        }
        return truncate(line.strip().replaceAll("\\s+", " "), LINE_PREVIEW_CHARS);
    }
}
