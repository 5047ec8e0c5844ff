package com.phillippitts.mcphub.util;

import java.util.Collection;
import java.util.Map;

/** Utility for privacy-safe logging of payload previews (transcripts, prompts, mail bodies). */
public final class LogSanitizer {
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
     * Describes a value by type and size instead of content, e.g. {@code String(1532)} or
     * {@code Map(4)}.
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence cs) {
            return "String(" + cs.length() + ")";
        }
        if (value instanceof Collection<?> c) {
            return value.getClass().getSimpleName() + "(" + c.size() + ")";
        }
        if (value instanceof Map<?, ?> m) {
            return "Map(" + m.size() + ")";
        }
        return value.getClass().getSimpleName();
    }
}
