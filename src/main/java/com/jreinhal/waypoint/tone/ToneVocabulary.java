package com.jreinhal.waypoint.tone;

import com.jreinhal.waypoint.model.Formality;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Romanized Hindi and formality word lists used by the statistical tone pass.
 */
final class ToneVocabulary {

    static final List<String> ULTRA_CASUAL = List.of(
            "bhai", "yaar", "boss", "dude", "bro", "mere bhai", "arre", "arey", "oye", "chal", "haan", "nahi",
            "kya baat", "sahi hai", "badhiya", "ekdum", "matlab", "basically", "actually");

    static final List<String> CASUAL = List.of(
            "thik hai", "okay", "theek", "accha", "acha", "achha", "haan ji", "nahi ji", "kaise", "kaisa", "kya",
            "samajh gaya", "samajh gayi", "ho gaya", "kar diya", "bilkul", "zaroor", "pakka", "sure", "theek hai");

    static final List<String> SEMI_FORMAL = List.of(
            "aap", "aapka", "aapki", "please", "thank you", "dhanyavaad", "shukriya", "maaf kijiye", "kripya",
            "ji", "sahab", "sir", "madam");

    static final List<String> CODE_MIXED = List.of(
            "kar do", "kar dijiye", "bata do", "bata dijiye", "help karo", "help kijiye", "problem hai",
            "issue hai", "samajh nahi aaya", "samajh nahi aa raha", "kya matlab hai", "kaise karu", "kaise karun");

    static final List<String> EXPRESSIONS = List.of(
            "acha", "achha", "hmm", "arre", "wah", "oh", "sahi", "nice", "great", "badiya", "mast",
            "kya baat hai", "zabardast", "shandar", "perfect");

    static final List<String> FORMAL_INDICATORS = List.of(
            "kindly", "request", "would you", "could you", "please assist", "appreciate", "grateful",
            "sir", "madam", "respected");

    static final List<String> CASUAL_INDICATORS = List.of(
            "btw", "lol", "omg", "gonna", "wanna", "yeah", "yep", "nope", "yup");

    /**
     * Single tokens that count as Hindi when measuring the language mix. English loanwords from the
     * lists above ("okay", "sure", "please") are left out so plain English is not miscounted.
     */
    static final Set<String> HINDI_TOKENS = Set.of(
            "bhai", "yaar", "arre", "arey", "oye", "chal", "haan", "nahi", "badhiya", "ekdum", "matlab",
            "thik", "theek", "accha", "acha", "achha", "kaise", "kaisa", "kya", "samajh", "gaya", "gayi",
            "diya", "bilkul", "zaroor", "pakka", "aap", "aapka", "aapki", "dhanyavaad", "shukriya", "maaf",
            "kijiye", "kripya", "ji", "sahab", "karo", "dijiye", "bata", "batao", "wah", "sahi", "badiya",
            "mast", "zabardast", "shandar", "kab", "kahan", "kyun", "kaun", "kitna", "kitne", "konsa", "konse");

    static final List<Pattern> ROMAN_HINDI = List.of(
            Pattern.compile("^(hai|hain|tha|thi|hoga|hogi|kar|kiya|kiye)$"),
            Pattern.compile("^(mein|hum|tum|aap|yeh|woh)$"),
            Pattern.compile("^(kuch|koi|sab|sabhi|ek|teen)$"));

    static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");

    private ToneVocabulary() {
    }

    static List<String> examplePhrases(boolean useHinglish, Formality formality) {
        if (useHinglish) {
            return switch (formality) {
                case CASUAL -> List.of("Bilkul, main samjha sakta hoon", "Haan, yeh kaam ho sakta hai",
                        "Theek hai, chaliye main batata hoon", "Arre haan, yeh bahut simple hai");
                case SEMI_FORMAL -> List.of("Ji bilkul, main aapki madad kar sakta hoon", "Haan ji, yeh possible hai",
                        "Theek hai, main aapko guide karta hoon", "Zaroor, main explain karta hoon");
                case FORMAL -> List.of("Certainly, I can help you with that", "Yes, this is definitely possible",
                        "Let me guide you through this", "I'll explain this clearly");
            };
        }
        return switch (formality) {
            case CASUAL -> List.of("Sure thing!", "Yeah, that works", "Got it, let me help", "No problem");
            case SEMI_FORMAL -> List.of("Certainly, I can assist", "Yes, that's possible", "Let me help you",
                    "I'll guide you");
            case FORMAL -> List.of("Certainly, I would be happy to assist", "Yes, that is absolutely possible",
                    "Allow me to guide you", "I will provide a comprehensive explanation");
        };
    }
}
