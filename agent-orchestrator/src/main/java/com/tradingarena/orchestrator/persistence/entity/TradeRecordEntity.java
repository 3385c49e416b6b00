package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only trade record. {@code closingPnl} is the only column updated after insert,
 * once the position a BUY opened is fully closed.
 */
@Data
@NoArgsConstructor
@Table("trade_records")
public class TradeRecordEntity {

    @Id
    private Long id;

    private String decisionId;

    private String agentName;

    private String cycleId;

    private String action;

    private String symbol;

    private BigDecimal quantity;

    private BigDecimal price;

    private BigDecimal fillPrice;

    private BigDecimal fee;

    private BigDecimal realizedPnl;

    private BigDecimal closingPnl;

    private String status;

    private String brokerOrderId;

    private String detail;

    private LocalDateTime executedAt;
}
