package com.phillippitts.mediatoolbox.util;

import java.util.List;

/** Utility for keeping tool output and argument vectors at a readable size in logs. */
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
     * Joins an argument vector for logging and truncates the result.
     */
    public static String describeArguments(List<String> args, int max) {
        if (args == null || args.isEmpty()) {
            return "[]";
        }
        return truncate(String.join(" ", args), max);
    }
}
