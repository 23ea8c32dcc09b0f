package com.phillippitts.mathscrap.util;

/** Helpers for logging recognized markup without flooding or breaking log lines. */
public final class LogSanitizer {

    /** Default preview length for markup in INFO/WARN logs. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of markup: control characters replaced by spaces, truncated to
     * {@link #PREVIEW_CHARS} with an ellipsis and the full length appended when cut.
     */
    public static String preview(String markup) {
        if (markup == null) {
            return "";
        }
        String flat = markup.replaceAll("\\p{Cntrl}", " ");
        if (flat.length() <= PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, PREVIEW_CHARS) + "...(" + flat.length() + " chars)";
    }
}
