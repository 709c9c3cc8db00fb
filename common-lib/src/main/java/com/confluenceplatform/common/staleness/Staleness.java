package com.confluenceplatform.common.staleness;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Freshness of a view or level relative to its source's publishing cadence.
 *
 * <ul>
 *   <li>FRESH   — younger than the soft threshold</li>
 *   <li>STALE   — at or past the soft threshold; still scored, shown with a warning</li>
 *   <li>EXPIRED — past the hard cutoff; excluded from scoring as if absent</li>
 * </ul>
 */
public enum Staleness {
    FRESH,
    STALE,
    EXPIRED;

    public boolean isStale() {
        return this != FRESH;
    }

    public boolean isUsable() {
        return this != EXPIRED;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }
}
