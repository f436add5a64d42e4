package com.jreinhal.waypoint.llm.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in strategies, in the order they are tried.
 */
public enum JsonParseStrategies implements ParseStrategy {

    /** The whole response is a JSON object. */
    DIRECT {
        @Override
        public ParseAttempt attempt(String raw, ObjectMapper objectMapper) {
            return readObject(this.name(), raw.trim(), objectMapper);
        }
    },

    /** The object sits inside a markdown code fence, with or without a {@code json} tag. */
    FENCED_CODE_BLOCK {
        @Override
        public ParseAttempt attempt(String raw, ObjectMapper objectMapper) {
            Matcher matcher = CODE_FENCE.matcher(raw);
            if (!matcher.find()) {
                return ParseAttempt.failure(this.name(), "no code fence");
            }
            return readObject(this.name(), matcher.group(1).trim(), objectMapper);
        }
    },

    /** The first brace-balanced {@code {...}} span, ignoring braces inside string literals. */
    BALANCED_BRACES {
        @Override
        public ParseAttempt attempt(String raw, ObjectMapper objectMapper) {
            int start = raw.indexOf('{');
            String lastError = "no opening brace";
            while (start >= 0) {
                int end = findClosingBrace(raw, start);
                if (end < 0) {
                    return ParseAttempt.failure(this.name(), "unbalanced braces");
                }
                ParseAttempt attempt = readObject(this.name(), raw.substring(start, end + 1), objectMapper);
                if (attempt.succeeded()) {
                    return attempt;
                }
                lastError = attempt.error();
                start = raw.indexOf('{', start + 1);
            }
            return ParseAttempt.failure(this.name(), lastError);
        }
    },

    /**
     * Repairs common near-JSON: smart or single quotes, unquoted keys, trailing commas,
     * Python literals and a missing final brace.
     */
    PUNCTUATION_CLEANUP {
        @Override
        public ParseAttempt attempt(String raw, ObjectMapper objectMapper) {
            int start = raw.indexOf('{');
            if (start < 0) {
                return ParseAttempt.failure(this.name(), "no opening brace");
            }
            int end = raw.lastIndexOf('}');
            String candidate = end > start ? raw.substring(start, end + 1) : raw.substring(start).trim() + "}";
            candidate = candidate.replace('\u201C', '"').replace('\u201D', '"')
                    .replace('\u2018', '\'').replace('\u2019', '\'');
            if (candidate.indexOf('"') < 0) {
                candidate = candidate.replace('\'', '"');
            }
            candidate = UNQUOTED_KEY.matcher(candidate).replaceAll("$1\"$2\":");
            candidate = TRAILING_COMMA.matcher(candidate).replaceAll("$1");
            candidate = PY_TRUE.matcher(candidate).replaceAll("true");
            candidate = PY_FALSE.matcher(candidate).replaceAll("false");
            candidate = PY_NONE.matcher(candidate).replaceAll("null");
            return readObject(this.name(), candidate, objectMapper);
        }
    };

    public static final List<ParseStrategy> DEFAULT_CHAIN = List.of(DIRECT, FENCED_CODE_BLOCK, BALANCED_BRACES,
            PUNCTUATION_CLEANUP);

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]*?)```");
    private static final Pattern UNQUOTED_KEY = Pattern.compile("([{,]\\s*)([A-Za-z_][A-Za-z0-9_]*)\\s*:");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    private static final Pattern PY_TRUE = Pattern.compile("(?<=[:\\[,]\\s?)True\\b");
    private static final Pattern PY_FALSE = Pattern.compile("(?<=[:\\[,]\\s?)False\\b");
    private static final Pattern PY_NONE = Pattern.compile("(?<=[:\\[,]\\s?)None\\b");

    private static ParseAttempt readObject(String strategy, String candidate, ObjectMapper objectMapper) {
        if (candidate.isEmpty()) {
            return ParseAttempt.failure(strategy, "empty candidate");
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return ParseAttempt.failure(strategy, "not a JSON object");
            }
            return ParseAttempt.success(strategy, node);
        }
        catch (JsonProcessingException e) {
            return ParseAttempt.failure(strategy, e.getOriginalMessage());
        }
    }

    static int findClosingBrace(String text, int openIndex) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = openIndex; i < text.length(); ++i) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                ++depth;
            } else if (c == '}') {
                --depth;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
