package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/** One row per decision that reached the execution stage, HOLDs included. */
@Data
@NoArgsConstructor
@Table("decision_log")
public class DecisionLogEntity {

    @Id
    private Long id;

    private String decisionId;

    private String agentName;

    private String cycleId;

    private String action;

    private String symbol;

    private BigDecimal quantity;

    private String reasoning;

    private Integer confidence;

    private String source;

    private Boolean parseFailure;

    private LocalDateTime decidedAt;
}
