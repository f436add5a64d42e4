package com.jreinhal.waypoint.llm.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.function.Predicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LlmJsonParserTest {

    private static final Predicate<JsonNode> HAS_NEEDS_SEARCH = node -> node.has("needsSearch");

    private LlmJsonParser parser;

    @BeforeEach
    void setUp() {
        parser = new LlmJsonParser(new ObjectMapper());
    }

    @Test
    @DisplayName("Plain JSON is parsed directly")
    void directJson() {
        ParseAttempt attempt = parser.parse("{\"needsSearch\": true, \"confidence\": 90}", HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertEquals("DIRECT", attempt.strategy());
        assertTrue(attempt.value().get("needsSearch").asBoolean());
    }

    @Test
    @DisplayName("JSON inside a markdown fence is extracted")
    void fencedJson() {
        String raw = "Here you go:\n```json\n{\"needsSearch\": false}\n```\nLet me know!";

        ParseAttempt attempt = parser.parse(raw, HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertEquals("FENCED_CODE_BLOCK", attempt.strategy());
        assertFalse(attempt.value().get("needsSearch").asBoolean());
    }

    @Test
    @DisplayName("Object embedded in prose is found by brace balancing")
    void embeddedObject() {
        String raw = "Sure! {\"reasoning\": \"has a } brace\", \"needsSearch\": true} hope this helps";

        ParseAttempt attempt = parser.parse(raw, HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertEquals("BALANCED_BRACES", attempt.strategy());
        assertEquals("has a } brace", attempt.value().get("reasoning").asText());
    }

    @Test
    @DisplayName("Single quotes, bare keys, Python literals and trailing commas are repaired")
    void repairsNearJson() {
        ParseAttempt attempt = parser.parse("{needsSearch: True, 'searchType': 'web', 'suggestedQuery': None,}",
                HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertEquals("PUNCTUATION_CLEANUP", attempt.strategy());
        assertTrue(attempt.value().get("needsSearch").asBoolean());
        assertEquals("web", attempt.value().get("searchType").asText());
        assertTrue(attempt.value().get("suggestedQuery").isNull());
    }

    @Test
    @DisplayName("Smart quotes are normalized")
    void repairsSmartQuotes() {
        ParseAttempt attempt = parser.parse("{\u201CneedsSearch\u201D: false}", HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertFalse(attempt.value().get("needsSearch").asBoolean());
    }

    @Test
    @DisplayName("A missing final brace is restored")
    void repairsMissingBrace() {
        ParseAttempt attempt = parser.parse("{\"needsSearch\": true, \"confidence\": 80", HAS_NEEDS_SEARCH);

        assertTrue(attempt.succeeded());
        assertEquals(80, attempt.value().get("confidence").asInt());
    }

    @Test
    @DisplayName("Objects failing the schema check are rejected")
    void schemaMismatch() {
        ParseAttempt attempt = parser.parse("{\"foo\": 1}", HAS_NEEDS_SEARCH);

        assertFalse(attempt.succeeded());
        assertThat(attempt.error()).contains("schema mismatch");
    }

    @Test
    @DisplayName("Prose without an object fails with every strategy's reason")
    void proseFails() {
        ParseAttempt attempt = parser.parse("I think you should search the web for that.", HAS_NEEDS_SEARCH);

        assertFalse(attempt.succeeded());
        assertThat(attempt.error()).contains("DIRECT").contains("FENCED_CODE_BLOCK").contains("no code fence");
    }

    @Test
    @DisplayName("Arrays are not accepted as verdicts")
    void arrayRejected() {
        ParseAttempt attempt = parser.parse("[1, 2, 3]", node -> true);

        assertFalse(attempt.succeeded());
    }

    @Test
    @DisplayName("Blank input fails without trying any strategy")
    void blankInput() {
        ParseAttempt attempt = parser.parse("   ", HAS_NEEDS_SEARCH);

        assertFalse(attempt.succeeded());
        assertEquals("empty response", attempt.error());
    }

    @Test
    @DisplayName("Closing brace search skips braces inside strings and escapes")
    void closingBraceIgnoresStrings() {
        String text = "{\"a\": \"x}\\\"}\", \"b\": {\"c\": 1}} tail";

        assertEquals(text.indexOf(" tail") - 1, JsonParseStrategies.findClosingBrace(text, 0));
        assertEquals(-1, JsonParseStrategies.findClosingBrace("{\"a\": 1", 0));
    }
}
