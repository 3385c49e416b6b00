package com.tradingarena.common.risk;

import java.math.BigDecimal;

/**
 * Exit thresholds for an open position, as fractions of its average entry price.
 *
 * @param stopLoss               loss at which the whole position is sold, e.g. 0.03 for -3%
 * @param takeProfit             gain at which the whole position is sold
 * @param partialTakeProfit      gain at which part of the position is sold once
 * @param partialTakeProfitRatio share of the position sold by the partial exit, in (0, 1]
 */
public record ExitRules(
    BigDecimal stopLoss,
    BigDecimal takeProfit,
    BigDecimal partialTakeProfit,
    BigDecimal partialTakeProfitRatio
) {

    public ExitRules {
        requirePositive(stopLoss, "stopLoss");
        requirePositive(takeProfit, "takeProfit");
        requirePositive(partialTakeProfit, "partialTakeProfit");
        requirePositive(partialTakeProfitRatio, "partialTakeProfitRatio");
        if (partialTakeProfitRatio.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("partialTakeProfitRatio must not exceed 1");
        }
    }

    private static void requirePositive(BigDecimal value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
