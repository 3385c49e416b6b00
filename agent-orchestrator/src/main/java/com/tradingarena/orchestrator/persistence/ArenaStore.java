package com.tradingarena.orchestrator.persistence;

import com.tradingarena.common.budget.BudgetState;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.PortfolioSnapshot;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable store for ledgers, positions, trade records, the decision log, portfolio
 * snapshots and daily budget usage.
 *
 * <p>The in-memory books are authoritative while the process runs; this store is what
 * they are loaded from at startup.
 */
public interface ArenaStore {

    Flux<AgentLedger> loadLedgers();

    Flux<Position> loadPositions();

    Mono<Void> saveLedger(AgentLedger ledger);

    Mono<Boolean> hasExecuted(String decisionId);

    /** Ledger upsert, position upsert or delete, trade record, decision log and closing P&amp;L in one transaction. */
    Mono<Void> persistExecution(ExecutionWrite write);

    /** Appends a NOT_EXECUTED or FAILED record together with its decision. */
    Mono<Void> appendTradeRecord(TradeRecord record, Decision decision);

    Mono<Void> logDecision(Decision decision);

    /** Newest first. */
    Flux<TradeRecord> recentTrades(String agentName, int limit);

    Mono<Void> savePositions(List<Position> positions);

    Mono<Void> appendSnapshot(PortfolioSnapshot snapshot);

    Mono<BudgetState> loadBudget(LocalDate day);

    Mono<Void> saveBudget(BudgetState state);
}
