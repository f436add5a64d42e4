package com.jreinhal.waypoint.model;

import java.util.List;

/**
 * Language mix and formality of a user's message.
 *
 * @param refined true when the formality label came from the model rather than the statistical pass
 */
public record ToneAnalysis(
        DetectedLanguage language,
        Formality formality,
        int hindiPercent,
        int englishPercent,
        List<String> hinglishPhrases,
        boolean shouldMatchTone,
        SuggestedStyle suggestedStyle,
        boolean refined) {

    public ToneAnalysis {
        hinglishPhrases = hinglishPhrases == null ? List.of() : List.copyOf(hinglishPhrases);
    }

    public static ToneAnalysis neutral() {
        return new ToneAnalysis(DetectedLanguage.ENGLISH, Formality.SEMI_FORMAL, 0, 100, List.of(), false,
                new SuggestedStyle(false, Formality.SEMI_FORMAL, List.of()), false);
    }

    public ToneAnalysis withFormality(Formality newFormality, SuggestedStyle newStyle) {
        return new ToneAnalysis(this.language, newFormality, this.hindiPercent, this.englishPercent,
                this.hinglishPhrases, this.shouldMatchTone, newStyle, true);
    }
}
