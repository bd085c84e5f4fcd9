package com.chatty.synth.util;

/** Utility for privacy-safe logging of prompt and answer previews. */
public final class LogSanitizer {

    /** Preview length used for prompts and model output in log lines. */
    public static final int PREVIEW_CHARS = 120;

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
     * Single-line preview of model text: newlines flattened, cut at {@link #PREVIEW_CHARS}.
     */
    public static String preview(String s) {
        return truncate(s, PREVIEW_CHARS).replace('\n', ' ').replace('\r', ' ');
    }
}
