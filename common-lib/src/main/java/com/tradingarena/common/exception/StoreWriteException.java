package com.tradingarena.common.exception;

/** A ledger or trade record write to the durable store failed after retries. */
public class StoreWriteException extends AgentException {

    public StoreWriteException(String agentName, String message, Throwable cause) {
        super(agentName, message, cause);
    }
}
