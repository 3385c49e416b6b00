package com.tradingarena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-agent account state.
 *
 * <p>Mutated only by the execution manager, one decision at a time per agent.
 * {@code pendingCount} counts BUY fills whose outcome has not been resolved by a
 * later SELL. {@code winningCount + losingCount} is the number of resolved trades.
 */
public record AgentLedger(
    @JsonProperty("agentName")      String agentName,
    @JsonProperty("initialCapital") BigDecimal initialCapital,
    @JsonProperty("cash")           BigDecimal cash,
    @JsonProperty("realizedProfit") BigDecimal realizedProfit,
    @JsonProperty("totalFees")      BigDecimal totalFees,
    @JsonProperty("tradeCount")     int tradeCount,
    @JsonProperty("winningCount")   int winningCount,
    @JsonProperty("losingCount")    int losingCount,
    @JsonProperty("pendingCount")   int pendingCount
) {

    public static AgentLedger opening(String agentName, BigDecimal initialCapital) {
        return new AgentLedger(agentName, initialCapital, initialCapital, BigDecimal.ZERO, BigDecimal.ZERO,
                               0, 0, 0, 0);
    }

    @JsonIgnore
    public int resolvedCount() {
        return winningCount + losingCount;
    }

    /** Winning share of resolved trades, or {@code null} when nothing has resolved yet. */
    @JsonIgnore
    public Double winRate() {
        int resolved = resolvedCount();
        return resolved == 0 ? null : (double) winningCount / resolved;
    }

    /** Net return on the initial capital of realized results after fees, as a percentage. */
    @JsonIgnore
    public BigDecimal realizedReturnPercent() {
        if (initialCapital.signum() == 0) return BigDecimal.ZERO;
        return realizedProfit.subtract(totalFees)
            .multiply(BigDecimal.valueOf(100))
            .divide(initialCapital, 4, RoundingMode.HALF_UP);
    }
}
