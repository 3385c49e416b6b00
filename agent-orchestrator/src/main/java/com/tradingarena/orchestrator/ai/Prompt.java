package com.tradingarena.orchestrator.ai;

public record Prompt(String system, String user) {

    public String combined() {
        return system + "\n\n" + user;
    }
}
