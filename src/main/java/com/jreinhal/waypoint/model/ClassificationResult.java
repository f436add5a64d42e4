package com.jreinhal.waypoint.model;

import java.util.Objects;

/**
 * Rule-table classification of a single message. Derived per request and never persisted.
 *
 * @param complexity estimated reasoning depth
 * @param domain     first matching keyword category, mapped to a domain
 * @param coreText   lowercased message with punctuation and stop words removed
 */
public record ClassificationResult(Complexity complexity, Domain domain, String coreText) {

    public ClassificationResult {
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(domain, "domain");
        coreText = coreText == null ? "" : coreText;
    }
}
