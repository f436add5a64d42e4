package com.jreinhal.waypoint.tone;

import com.jreinhal.waypoint.model.ToneAnalysis;

/**
 * Cached tone for one user plus how many messages it has answered since it was computed.
 */
public record ToneCacheEntry(ToneAnalysis analysis, int servedCount) {

    public ToneCacheEntry served() {
        return new ToneCacheEntry(this.analysis, this.servedCount + 1);
    }
}
