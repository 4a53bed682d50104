package com.kotsin.enrichment.model;

import java.util.Locale;

/**
 * Directional hint carried by a signal.
 */
public enum Direction {
    BUY,
    SELL,
    HOLD,
    NONE;

    /**
     * Parse a raw direction string. LONG/SHORT/NEUTRAL are accepted as aliases.
     *
     * @return the direction, or null when the value is not recognised
     */
    public static Direction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "BUY":
            case "LONG":
                return BUY;
            case "SELL":
            case "SHORT":
                return SELL;
            case "HOLD":
            case "NEUTRAL":
                return HOLD;
            case "NONE":
                return NONE;
            default:
                return null;
        }
    }
}
