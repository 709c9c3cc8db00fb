package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a level is expected to trade.
 *
 * <ul>
 *   <li>BULLISH_REVERSAL  — buy at support, expecting a bounce</li>
 *   <li>BEARISH_REVERSAL  — sell at resistance, expecting rejection</li>
 *   <li>BULLISH_BREAKOUT  — buy above the level on a breakout</li>
 *   <li>BEARISH_BREAKDOWN — sell below the level on a breakdown</li>
 *   <li>NEUTRAL           — informational only</li>
 * </ul>
 */
public enum LevelDirection {
    BULLISH_REVERSAL,
    BEARISH_REVERSAL,
    BULLISH_BREAKOUT,
    BEARISH_BREAKDOWN,
    NEUTRAL;

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }

    /** Unknown or missing direction degrades to {@link #NEUTRAL}. */
    @JsonCreator
    public static LevelDirection fromId(String id) {
        if (id == null) return NEUTRAL;
        for (LevelDirection d : values()) {
            if (d.id().equalsIgnoreCase(id.trim())) return d;
        }
        return NEUTRAL;
    }
}
