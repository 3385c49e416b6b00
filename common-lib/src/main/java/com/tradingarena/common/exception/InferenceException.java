package com.tradingarena.common.exception;

/** The inference provider returned an error or an unusable envelope. */
public class InferenceException extends AgentException {

    public InferenceException(String agentName, String message) {
        super(agentName, message);
    }

    public InferenceException(String agentName, String message, Throwable cause) {
        super(agentName, message, cause);
    }
}
