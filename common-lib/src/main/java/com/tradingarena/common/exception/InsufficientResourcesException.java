package com.tradingarena.common.exception;

/**
 * A BUY that the agent's cash cannot cover, or a SELL larger than its holding.
 * Recorded as a NOT_EXECUTED trade; the ledger is left untouched.
 */
public class InsufficientResourcesException extends AgentException {

    public InsufficientResourcesException(String agentName, String message) {
        super(agentName, message);
    }
}
