package com.tradingarena.common.exception;

public class UnknownAgentException extends AgentException {

    public UnknownAgentException(String agentName) {
        super(agentName, "no agent registered under this name");
    }
}
