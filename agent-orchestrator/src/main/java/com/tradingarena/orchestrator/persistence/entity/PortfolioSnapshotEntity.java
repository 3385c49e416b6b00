package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("portfolio_snapshots")
public class PortfolioSnapshotEntity {

    @Id
    private Long id;

    private String agentName;

    private BigDecimal cash;

    private BigDecimal positionsValue;

    private BigDecimal totalValue;

    private BigDecimal realizedProfit;

    private BigDecimal unrealizedProfit;

    private BigDecimal totalFees;

    private Integer openPositions;

    private LocalDateTime takenAt;
}
