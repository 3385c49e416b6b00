package com.tradingarena.common.session;

public enum MarketSession {
    PRE_MARKET,
    REGULAR,
    AFTER_HOURS,
    CLOSED;

    public boolean isOpen() {
        return this == REGULAR;
    }
}
