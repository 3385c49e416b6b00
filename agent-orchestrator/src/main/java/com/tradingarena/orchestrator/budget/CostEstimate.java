package com.tradingarena.orchestrator.budget;

import java.math.BigDecimal;

public record CostEstimate(long inputTokens, long outputTokens, BigDecimal cost) {

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
