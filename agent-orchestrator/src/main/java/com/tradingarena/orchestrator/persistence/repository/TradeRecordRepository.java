package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.TradeRecordEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;

@Repository
public interface TradeRecordRepository extends ReactiveCrudRepository<TradeRecordEntity, Long> {

    @Query("""
        SELECT * FROM trade_records
        WHERE agent_name = :agentName
        ORDER BY executed_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<TradeRecordEntity> findRecent(String agentName, int limit);

    /**
     * Attaches the round-trip result of a closed position to the filled BUY records
     * that opened it. Records of earlier, already-closed positions keep their value, and
     * BUYs executed after {@code closedAt} belong to a later position and are left alone.
     */
    @Modifying
    @Query("""
        UPDATE trade_records
        SET closing_pnl = :closingPnl
        WHERE agent_name = :agentName
          AND symbol = :symbol
          AND action = 'BUY'
          AND status = 'FILLED'
          AND closing_pnl IS NULL
          AND executed_at <= :closedAt
        """)
    Mono<Void> attachClosingPnl(String agentName, String symbol, BigDecimal closingPnl, Instant closedAt);
}
