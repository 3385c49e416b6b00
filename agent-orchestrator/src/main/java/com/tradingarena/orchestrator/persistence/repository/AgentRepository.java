package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.AgentEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

@Repository
public interface AgentRepository extends ReactiveCrudRepository<AgentEntity, String> {

    /** Inserts the agent row or overwrites its ledger columns; {@code initial_capital} is kept once set. */
    @Modifying
    @Query("""
        INSERT INTO agents
            (agent_name, initial_capital, cash, realized_profit, total_fees,
             trade_count, winning_count, losing_count, pending_count, updated_at)
        VALUES
            (:agentName, :initialCapital, :cash, :realizedProfit, :totalFees,
             :tradeCount, :winningCount, :losingCount, :pendingCount, NOW())
        ON CONFLICT (agent_name) DO UPDATE SET
            cash            = :cash,
            realized_profit = :realizedProfit,
            total_fees      = :totalFees,
            trade_count     = :tradeCount,
            winning_count   = :winningCount,
            losing_count    = :losingCount,
            pending_count   = :pendingCount,
            updated_at      = NOW()
        """)
    Mono<Void> upsertLedger(String agentName, BigDecimal initialCapital, BigDecimal cash,
                            BigDecimal realizedProfit, BigDecimal totalFees, int tradeCount,
                            int winningCount, int losingCount, int pendingCount);
}
