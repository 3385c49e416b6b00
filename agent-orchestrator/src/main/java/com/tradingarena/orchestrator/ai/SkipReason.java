package com.tradingarena.orchestrator.ai;

public enum SkipReason {
    BUDGET_EXCEEDED,
    CIRCUIT_OPEN,
    DATA_UNAVAILABLE,
    INFERENCE_FAILED,
    TIMEOUT
}
