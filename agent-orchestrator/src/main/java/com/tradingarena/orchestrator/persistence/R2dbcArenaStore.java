package com.tradingarena.orchestrator.persistence;

import com.tradingarena.common.budget.BudgetState;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.PortfolioSnapshot;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.orchestrator.persistence.repository.AgentRepository;
import com.tradingarena.orchestrator.persistence.repository.BudgetUsageRepository;
import com.tradingarena.orchestrator.persistence.repository.DecisionLogRepository;
import com.tradingarena.orchestrator.persistence.repository.PortfolioSnapshotRepository;
import com.tradingarena.orchestrator.persistence.repository.PositionRepository;
import com.tradingarena.orchestrator.persistence.repository.TradeRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

/**
 * PostgreSQL-backed {@link ArenaStore}. Multi-row writes for one execution share a
 * transaction; retries are the caller's concern.
 */
@Component
public class R2dbcArenaStore implements ArenaStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcArenaStore.class);

    private final AgentRepository agents;
    private final PositionRepository positions;
    private final TradeRecordRepository trades;
    private final DecisionLogRepository decisions;
    private final PortfolioSnapshotRepository snapshots;
    private final BudgetUsageRepository budget;
    private final TransactionalOperator tx;

    public R2dbcArenaStore(AgentRepository agents, PositionRepository positions, TradeRecordRepository trades,
                           DecisionLogRepository decisions, PortfolioSnapshotRepository snapshots,
                           BudgetUsageRepository budget, TransactionalOperator tx) {
        this.agents    = agents;
        this.positions = positions;
        this.trades    = trades;
        this.decisions = decisions;
        this.snapshots = snapshots;
        this.budget    = budget;
        this.tx        = tx;
    }

    @Override
    public Flux<AgentLedger> loadLedgers() {
        return agents.findAll().map(ArenaEntityMapper::toLedger);
    }

    @Override
    public Flux<Position> loadPositions() {
        return positions.findAll().map(ArenaEntityMapper::toPosition);
    }

    @Override
    public Mono<Void> saveLedger(AgentLedger l) {
        return agents.upsertLedger(l.agentName(), l.initialCapital(), l.cash(), l.realizedProfit(), l.totalFees(),
                                   l.tradeCount(), l.winningCount(), l.losingCount(), l.pendingCount());
    }

    @Override
    public Mono<Boolean> hasExecuted(String decisionId) {
        return decisions.existsByDecisionId(decisionId);
    }

    @Override
    public Mono<Void> persistExecution(ExecutionWrite write) {
        String agent = write.agentName();
        Mono<Void> position = write.position() == null
            ? positions.deletePosition(agent, write.symbol())
            : upsertPosition(write.position());
        Mono<Void> closing = write.closingPnl() == null
            ? Mono.empty()
            : trades.attachClosingPnl(agent, write.symbol(), write.closingPnl(), write.record().executedAt());

        return saveLedger(write.ledger())
            .then(position)
            .then(closing)
            .then(decisions.save(ArenaEntityMapper.toEntity(write.decision())))
            .then(trades.save(ArenaEntityMapper.toEntity(write.record())))
            .then()
            .as(tx::transactional)
            .doOnSuccess(v -> log.debug("EXECUTION_PERSISTED agent={} decisionId={}",
                                        agent, write.record().decisionId()));
    }

    @Override
    public Mono<Void> appendTradeRecord(TradeRecord record, Decision decision) {
        return decisions.save(ArenaEntityMapper.toEntity(decision))
            .then(trades.save(ArenaEntityMapper.toEntity(record)))
            .then()
            .as(tx::transactional);
    }

    @Override
    public Mono<Void> logDecision(Decision decision) {
        return decisions.save(ArenaEntityMapper.toEntity(decision)).then();
    }

    @Override
    public Flux<TradeRecord> recentTrades(String agentName, int limit) {
        return trades.findRecent(agentName, limit).map(ArenaEntityMapper::toTradeRecord);
    }

    @Override
    public Mono<Void> savePositions(List<Position> marked) {
        return Flux.fromIterable(marked)
            .concatMap(this::upsertPosition)
            .then()
            .as(tx::transactional);
    }

    @Override
    public Mono<Void> appendSnapshot(PortfolioSnapshot snapshot) {
        return snapshots.save(ArenaEntityMapper.toEntity(snapshot)).then();
    }

    @Override
    public Mono<BudgetState> loadBudget(LocalDate day) {
        return budget.findById(day).map(ArenaEntityMapper::toBudgetState);
    }

    @Override
    public Mono<Void> saveBudget(BudgetState state) {
        return budget.upsertUsage(state.day(), state.tokensUsed(), state.costUsed(), state.ceiling());
    }

    private Mono<Void> upsertPosition(Position p) {
        return positions.upsertPosition(p.agentName(), p.symbol(), p.quantity(), p.costBasis(),
                                        p.lastPrice(), p.realizedSinceOpen());
    }
}
