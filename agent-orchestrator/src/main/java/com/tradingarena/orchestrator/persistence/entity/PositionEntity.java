package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Open holding; unique on (agent_name, symbol), quantity always positive. */
@Data
@NoArgsConstructor
@Table("positions")
public class PositionEntity {

    @Id
    private Long id;

    private String agentName;

    private String symbol;

    private BigDecimal quantity;

    private BigDecimal costBasis;

    private BigDecimal lastPrice;

    private BigDecimal realizedSinceOpen;

    private LocalDateTime updatedAt;
}
