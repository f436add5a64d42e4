package com.jreinhal.waypoint.llm.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chain of responsibility over {@link ParseStrategy} instances. The first strategy whose output
 * also satisfies the caller's schema check wins.
 */
@Component
public class LlmJsonParser {
    private static final Logger log = LoggerFactory.getLogger(LlmJsonParser.class);

    private final ObjectMapper objectMapper;
    private final List<ParseStrategy> strategies;

    public LlmJsonParser(ObjectMapper objectMapper) {
        this(objectMapper, JsonParseStrategies.DEFAULT_CHAIN);
    }

    public LlmJsonParser(ObjectMapper objectMapper, List<ParseStrategy> strategies) {
        this.objectMapper = objectMapper;
        this.strategies = List.copyOf(strategies);
    }

    public ParseAttempt parse(String raw, Predicate<JsonNode> schema) {
        if (raw == null || raw.isBlank()) {
            return ParseAttempt.failure("none", "empty response");
        }
        List<String> errors = new ArrayList<>();
        for (ParseStrategy strategy : this.strategies) {
            ParseAttempt attempt = strategy.attempt(raw, this.objectMapper);
            if (!attempt.succeeded()) {
                errors.add(strategy.name() + ": " + attempt.error());
                continue;
            }
            if (!schema.test(attempt.value())) {
                errors.add(strategy.name() + ": schema mismatch");
                continue;
            }
            if (log.isDebugEnabled()) {
                log.debug("Model output parsed by {} after {} failed attempt(s)", strategy.name(), errors.size());
            }
            return attempt;
        }
        return ParseAttempt.failure("none", String.join("; ", errors));
    }
}
