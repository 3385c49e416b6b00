package com.tradingarena.common.model;

/**
 * Identifies how a {@link Decision} was produced.
 */
public enum DecisionSource {
    /** One governed inference call by the agent itself. */
    OWN_INFERENCE,
    /** Weighted vote of the other agents' decisions; no inference call. */
    AGGREGATED,
    /** Stop-loss or take-profit sell raised by the position review; no inference call. */
    EXIT_RULE
}
