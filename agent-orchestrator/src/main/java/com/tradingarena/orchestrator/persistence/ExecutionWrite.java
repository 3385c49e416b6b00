package com.tradingarena.orchestrator.persistence;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeRecord;

import java.math.BigDecimal;

/**
 * Everything one filled execution writes, persisted in a single transaction.
 *
 * @param position   the position after the fill, or {@code null} when the fill closed it
 * @param closingPnl set when the fill closed the position; attached to its open BUY records
 */
public record ExecutionWrite(
    AgentLedger ledger,
    String symbol,
    Position position,
    TradeRecord record,
    Decision decision,
    BigDecimal closingPnl
) {

    public String agentName() {
        return ledger.agentName();
    }

    public ExecutionWrite withBooks(AgentLedger latestLedger, Position latestPosition) {
        return new ExecutionWrite(latestLedger, symbol, latestPosition, record, decision, closingPnl);
    }
}
