package com.tradingarena.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only record of a decision that reached the execution stage.
 *
 * <p>{@code decisionId} is unique across records and is the idempotency key.
 * {@code price} is the reference price the ledger was booked at; {@code fillPrice}
 * is what the broker reported, when it reported one. {@code realizedPnl} is set on
 * SELL records; {@code closingPnl} is set on the BUY record that opened a position
 * once that position is fully closed.
 */
public record TradeRecord(
    String decisionId,
    String agentName,
    String cycleId,
    TradeAction action,
    String symbol,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal fillPrice,
    BigDecimal fee,
    BigDecimal realizedPnl,
    BigDecimal closingPnl,
    TradeStatus status,
    String brokerOrderId,
    String detail,
    Instant executedAt
) {

    public boolean isFilled() {
        return status == TradeStatus.FILLED;
    }

    public TradeRecord withClosingPnl(BigDecimal pnl) {
        return new TradeRecord(decisionId, agentName, cycleId, action, symbol, quantity, price, fillPrice, fee,
                               realizedPnl, pnl, status, brokerOrderId, detail, executedAt);
    }
}
