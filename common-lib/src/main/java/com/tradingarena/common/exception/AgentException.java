package com.tradingarena.common.exception;

/**
 * Base of every failure scoped to one agent's pipeline. The cycle catches these per agent,
 * so one agent failing never stops the others.
 */
public abstract class AgentException extends RuntimeException {

    private final String agentName;

    protected AgentException(String agentName, String message) {
        this(agentName, message, null);
    }

    protected AgentException(String agentName, String message, Throwable cause) {
        super("agent=" + agentName + " " + message, cause);
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
