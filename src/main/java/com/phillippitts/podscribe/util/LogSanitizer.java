package com.phillippitts.podscribe.util;

/**
 * Shortens transcript text before it reaches a log line.
 *
 * <p>Transcript bodies can be long and span many lines, so log output only ever carries a flattened,
 * bounded excerpt.
 */
public final class LogSanitizer {

    static final String ELLIPSIS = "...";

    private LogSanitizer() {
    }

    /** First {@code max} characters of {@code text}; empty for null input or a non-positive limit. */
    public static String truncate(String text, int max) {
        if (text == null || max <= 0) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    /**
     * Single-line excerpt: runs of whitespace (newlines included) become one space, and text longer
     * than {@code max} is cut and suffixed with {@value #ELLIPSIS}.
     */
    public static String excerpt(String text, int max) {
        String flat = text == null ? "" : text.strip().replaceAll("\\s+", " ");
        if (flat.length() <= max) {
            return truncate(flat, max);
        }
        return truncate(flat, max) + ELLIPSIS;
    }
}
