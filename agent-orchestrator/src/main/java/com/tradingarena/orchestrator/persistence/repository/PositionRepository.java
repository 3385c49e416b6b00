package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.PositionEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

@Repository
public interface PositionRepository extends ReactiveCrudRepository<PositionEntity, Long> {

    @Modifying
    @Query("""
        INSERT INTO positions
            (agent_name, symbol, quantity, cost_basis, last_price, realized_since_open, updated_at)
        VALUES
            (:agentName, :symbol, :quantity, :costBasis, :lastPrice, :realizedSinceOpen, NOW())
        ON CONFLICT (agent_name, symbol) DO UPDATE SET
            quantity            = :quantity,
            cost_basis          = :costBasis,
            last_price          = :lastPrice,
            realized_since_open = :realizedSinceOpen,
            updated_at          = NOW()
        """)
    Mono<Void> upsertPosition(String agentName, String symbol, BigDecimal quantity, BigDecimal costBasis,
                              BigDecimal lastPrice, BigDecimal realizedSinceOpen);

    @Modifying
    @Query("DELETE FROM positions WHERE agent_name = :agentName AND symbol = :symbol")
    Mono<Void> deletePosition(String agentName, String symbol);
}
