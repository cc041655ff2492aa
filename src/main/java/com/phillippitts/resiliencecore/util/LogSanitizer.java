package com.phillippitts.resiliencecore.util;

/** Helpers for privacy-safe logging of prompts and provider output. */
public final class LogSanitizer {
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
     * Single-line preview for logs: control characters replaced by spaces, then truncated
     * with a trailing ellipsis when shortened.
     */
    public static String preview(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ");
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
