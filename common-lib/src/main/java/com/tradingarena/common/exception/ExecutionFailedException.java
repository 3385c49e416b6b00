package com.tradingarena.common.exception;

/** The brokerage call failed, timed out, or returned a status that is not an acceptance. */
public class ExecutionFailedException extends AgentException {

    private final String decisionId;

    public ExecutionFailedException(String agentName, String decisionId, String message) {
        super(agentName, message);
        this.decisionId = decisionId;
    }

    public ExecutionFailedException(String agentName, String decisionId, String message, Throwable cause) {
        super(agentName, message, cause);
        this.decisionId = decisionId;
    }

    public String getDecisionId() {
        return decisionId;
    }
}
