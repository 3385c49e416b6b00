package com.tradingarena.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time valuation of one agent: cash plus open positions marked to market.
 */
public record PortfolioSnapshot(
    String agentName,
    BigDecimal cash,
    BigDecimal positionsValue,
    BigDecimal totalValue,
    BigDecimal realizedProfit,
    BigDecimal unrealizedProfit,
    BigDecimal totalFees,
    int openPositions,
    Instant takenAt
) {}
