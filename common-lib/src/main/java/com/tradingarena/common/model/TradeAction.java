package com.tradingarena.common.model;

/**
 * The three actions a decision can carry. Anything the inference provider returns
 * outside this set is treated as malformed by the response parser.
 */
public enum TradeAction {
    BUY,
    SELL,
    HOLD;

    /**
     * Lenient lookup: trims and upper-cases the raw value.
     *
     * @return the matching action, or {@code null} when the value is not a known action
     */
    public static TradeAction parse(String raw) {
        if (raw == null) return null;
        try {
            return TradeAction.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isTrade() {
        return this != HOLD;
    }
}
