package com.confluenceplatform.common.model;

/**
 * Setup direction stated in a trade-setup summary.
 *
 * <ul>
 *   <li>LONG  — aligned bullish views</li>
 *   <li>SHORT — aligned bearish views</li>
 *   <li>FLAT  — no directional agreement; never emitted in a setup</li>
 * </ul>
 */
public enum TradeDirection {

    LONG,
    SHORT,
    FLAT;

    /** Derives direction from an agreed view bias. */
    public static TradeDirection fromBias(ViewBias bias) {
        if (bias == ViewBias.BULLISH) return LONG;
        if (bias == ViewBias.BEARISH) return SHORT;
        return FLAT;
    }
}
