package com.tradingarena.common.ledger;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Position;

import java.math.BigDecimal;

/**
 * Result of applying one filled trade to an agent's books.
 *
 * @param ledger         the agent ledger after the trade
 * @param position       the position after the trade, {@code null} when the trade closed it
 * @param realizedPnl    realized result of a SELL, zero for a BUY
 * @param positionClosed {@code true} when a SELL reduced the holding to zero
 * @param closingPnl     full round-trip result of the position when closed, otherwise {@code null}
 */
public record LedgerMutation(
    AgentLedger ledger,
    Position position,
    BigDecimal realizedPnl,
    boolean positionClosed,
    BigDecimal closingPnl
) {}
