package com.jreinhal.waypoint.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    // Letters, combining marks (Devanagari matras) and digits survive; everything else is punctuation.
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NEVER_MATCHES = Pattern.compile("(?!)");
    private static final String WORD_CHAR = "[\\p{L}\\p{M}\\p{N}]";

    private TextNormalizer() {
    }

    /**
     * Lowercases, drops punctuation without leaving a gap ("hi-tech" becomes "hitech") and collapses whitespace.
     */
    public static String stripPunctuation(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return collapseWhitespace(PUNCTUATION.matcher(lower).replaceAll(""));
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }

    public static List<String> words(String text) {
        String collapsed = collapseWhitespace(text);
        if (collapsed.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(collapsed));
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    /**
     * Case-insensitive alternation over the given phrases, anchored so a phrase only matches as whole
     * words ("kal" never matches inside "local"). Internal spaces match any run of whitespace.
     * Longer phrases are tried first. An empty collection yields a pattern that never matches.
     */
    public static Pattern phrasePattern(Collection<String> phrases) {
        List<String> sorted = new ArrayList<>();
        for (String phrase : phrases) {
            String collapsed = collapseWhitespace(phrase).toLowerCase(Locale.ROOT);
            if (!collapsed.isEmpty() && !sorted.contains(collapsed)) {
                sorted.add(collapsed);
            }
        }
        if (sorted.isEmpty()) {
            return NEVER_MATCHES;
        }
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alternation = new StringBuilder();
        for (String phrase : sorted) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            String[] parts = WHITESPACE.split(phrase);
            for (int i = 0; i < parts.length; ++i) {
                if (i > 0) {
                    alternation.append("\\s+");
                }
                alternation.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile("(?<!" + WORD_CHAR + ")(?:" + alternation + ")(?!" + WORD_CHAR + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
