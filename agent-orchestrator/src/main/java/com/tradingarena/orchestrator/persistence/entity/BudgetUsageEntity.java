package com.tradingarena.orchestrator.persistence.entity;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/** Inference spend for one day in the budget's time zone. */
@Data
@NoArgsConstructor
@Table("inference_budget_usage")
public class BudgetUsageEntity {

    @Id
    private LocalDate usageDay;

    private Long tokensUsed;

    private BigDecimal costUsed;

    private BigDecimal ceiling;

    private LocalDateTime updatedAt;
}
