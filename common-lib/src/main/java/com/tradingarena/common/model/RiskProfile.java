package com.tradingarena.common.model;

/**
 * Risk appetite stated in an agent's prompt. Used as a label only; sizing is left to
 * the model and bounded by the ledger's cash and holdings.
 */
public enum RiskProfile {
    CONSERVATIVE,
    MODERATE,
    AGGRESSIVE
}
