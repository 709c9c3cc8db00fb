package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Directional stance of a source view, mapped to a normalized signal:
 * BULLISH=+1, NEUTRAL=0, BEARISH=−1.
 */
public enum ViewBias {
    BULLISH(1),
    NEUTRAL(0),
    BEARISH(-1);

    private final int signal;

    ViewBias(int signal) {
        this.signal = signal;
    }

    public int signal() {
        return signal;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ViewBias fromId(String id) {
        if (id == null) return null;
        for (ViewBias b : values()) {
            if (b.id().equalsIgnoreCase(id.trim())) return b;
        }
        return null;
    }
}
