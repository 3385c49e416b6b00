package com.tradingarena.common.model;

public enum TradeStatus {
    /** Accepted by the broker and applied to the ledger. */
    FILLED,
    /** Rejected locally: insufficient cash or holdings. No order was sent. */
    NOT_EXECUTED,
    /** The broker call failed, timed out or returned a non-accepted status. */
    FAILED
}
