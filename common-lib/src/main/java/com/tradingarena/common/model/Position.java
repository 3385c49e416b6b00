package com.tradingarena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Open holding of one symbol by one agent. A position with zero quantity does not
 * exist: the ledger calculator removes it instead of storing it.
 *
 * <p>{@code costBasis} is the total amount paid for the shares still held.
 * {@code realizedSinceOpen} accumulates partial-sell results so the full round-trip
 * result is known once the position closes.
 */
public record Position(
    String agentName,
    String symbol,
    BigDecimal quantity,
    BigDecimal costBasis,
    BigDecimal lastPrice,
    BigDecimal realizedSinceOpen
) {

    public Position {
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("position quantity must be positive, got " + quantity);
        }
    }

    @JsonIgnore
    public BigDecimal averageEntryPrice() {
        return costBasis.divide(quantity, 8, RoundingMode.HALF_UP);
    }

    @JsonIgnore
    public BigDecimal marketValue() {
        return quantity.multiply(lastPrice);
    }

    @JsonIgnore
    public BigDecimal unrealizedPnl() {
        return marketValue().subtract(costBasis);
    }

    public Position markTo(BigDecimal price) {
        return new Position(agentName, symbol, quantity, costBasis, price, realizedSinceOpen);
    }
}
