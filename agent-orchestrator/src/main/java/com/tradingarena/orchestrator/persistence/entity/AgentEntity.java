package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Ledger row per agent. Written through an upsert keyed on {@code agent_name}.
 */
@Data
@NoArgsConstructor
@Table("agents")
public class AgentEntity {

    @Id
    private String agentName;

    private BigDecimal initialCapital;

    private BigDecimal cash;

    private BigDecimal realizedProfit;

    private BigDecimal totalFees;

    private Integer tradeCount;

    private Integer winningCount;

    private Integer losingCount;

    private Integer pendingCount;

    private LocalDateTime updatedAt;
}
