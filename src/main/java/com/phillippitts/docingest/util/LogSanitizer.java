package com.phillippitts.docingest.util;

import java.util.regex.Pattern;

/**
 * Shortens user-supplied file names and backend messages before they reach a log line.
 */
public final class LogSanitizer {

    private static final int FILE_NAME_LIMIT = 80;
    private static final Pattern CONTROL_CHARS = Pattern.compile("\\p{Cntrl}");

    private LogSanitizer() {}

    /** At most {@code max} leading characters of {@code s}; empty for null or a non-positive limit. */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() > max ? s.substring(0, max) : s;
    }

    /** File name cut to 80 characters, each control character shown as {@code ?}. */
    public static String fileName(String name) {
        return CONTROL_CHARS.matcher(truncate(name, FILE_NAME_LIMIT)).replaceAll("?");
    }
}
