package com.tradingarena.orchestrator.persistence.repository;

import com.tradingarena.orchestrator.persistence.entity.BudgetUsageEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;

@Repository
public interface BudgetUsageRepository extends ReactiveCrudRepository<BudgetUsageEntity, LocalDate> {

    @Modifying
    @Query("""
        INSERT INTO inference_budget_usage (usage_day, tokens_used, cost_used, ceiling, updated_at)
        VALUES (:usageDay, :tokensUsed, :costUsed, :ceiling, NOW())
        ON CONFLICT (usage_day) DO UPDATE SET
            tokens_used = :tokensUsed,
            cost_used   = :costUsed,
            ceiling     = :ceiling,
            updated_at  = NOW()
        """)
    Mono<Void> upsertUsage(LocalDate usageDay, long tokensUsed, BigDecimal costUsed, BigDecimal ceiling);
}
