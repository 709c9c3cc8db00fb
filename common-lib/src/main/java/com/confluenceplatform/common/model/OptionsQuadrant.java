package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Options-positioning quadrant combining direction with the implied-volatility regime.
 *
 * <pre>
 *   SELL_PUT  — bullish, rich IV      SELL_CALL — bearish, rich IV
 *   BUY_CALL  — bullish, cheap IV     BUY_PUT   — bearish, cheap IV
 *   NEUTRAL   — spreads / no lean
 * </pre>
 */
public enum OptionsQuadrant {
    BUY_CALL(ViewBias.BULLISH),
    SELL_PUT(ViewBias.BULLISH),
    BUY_PUT(ViewBias.BEARISH),
    SELL_CALL(ViewBias.BEARISH),
    NEUTRAL(ViewBias.NEUTRAL);

    private final ViewBias bias;

    OptionsQuadrant(ViewBias bias) {
        this.bias = bias;
    }

    /** Directional bias implied by this quadrant. */
    public ViewBias bias() {
        return bias;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OptionsQuadrant fromId(String id) {
        if (id == null) return null;
        for (OptionsQuadrant q : values()) {
            if (q.id().equalsIgnoreCase(id.trim())) return q;
        }
        return null;
    }
}
