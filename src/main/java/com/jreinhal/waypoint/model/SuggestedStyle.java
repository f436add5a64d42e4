package com.jreinhal.waypoint.model;

import java.util.List;

public record SuggestedStyle(boolean useHinglish, Formality formalityLevel, List<String> examplePhrases) {

    public SuggestedStyle {
        examplePhrases = examplePhrases == null ? List.of()
                : List.copyOf(examplePhrases.subList(0, Math.min(4, examplePhrases.size())));
    }
}
