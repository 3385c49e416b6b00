package com.tradingarena.orchestrator.controller.dto;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.AgentProfile;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Leaderboard row: ledger counters plus performance against initial capital, with open
 * positions at their last mark.
 */
public record AgentStanding(
    String agentName,
    String variant,
    String modelId,
    boolean consortium,
    BigDecimal initialCapital,
    BigDecimal cash,
    BigDecimal portfolioValue,
    BigDecimal performancePercent,
    BigDecimal realizedProfit,
    BigDecimal totalFees,
    Double winRate,
    int tradeCount,
    int winningCount,
    int losingCount,
    int pendingCount,
    int openPositions
) {

    public static AgentStanding of(AgentProfile profile, AgentLedger ledger, BigDecimal portfolioValue,
                                   int openPositions) {
        BigDecimal initial = ledger.initialCapital();
        BigDecimal performance = initial.signum() == 0
            ? BigDecimal.ZERO
            : portfolioValue.subtract(initial)
                .multiply(BigDecimal.valueOf(100))
                .divide(initial, 2, RoundingMode.HALF_UP);
        return new AgentStanding(
            profile.name(),
            profile.variant() == null ? null : profile.variant().name(),
            profile.modelId(),
            profile.consortium(),
            initial, ledger.cash(), portfolioValue, performance,
            ledger.realizedProfit(), ledger.totalFees(), ledger.winRate(),
            ledger.tradeCount(), ledger.winningCount(), ledger.losingCount(), ledger.pendingCount(),
            openPositions);
    }
}
