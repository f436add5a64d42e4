package com.jreinhal.waypoint.util;

import java.util.regex.Pattern;

/**
 * Helpers for putting user-supplied text into log lines. Raw message text is never logged;
 * callers log a summary or a stripped, truncated preview.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int DEFAULT_PREVIEW = 80;

    private LogSanitizer() {
    }

    /**
     * Length plus a stable hash, enough to correlate log lines for one message without exposing it.
     */
    public static String querySummary(String text) {
        if (text == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + text.length() + ",id=" + Integer.toHexString(text.hashCode()) + "]";
    }

    /**
     * Strips control characters so a value cannot forge extra log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    public static String preview(String value) {
        return preview(value, DEFAULT_PREVIEW);
    }

    public static String preview(String value, int maxLength) {
        String clean = sanitize(value);
        if (clean.length() <= maxLength) {
            return clean;
        }
        return clean.substring(0, Math.max(0, maxLength)) + "...";
    }
}
