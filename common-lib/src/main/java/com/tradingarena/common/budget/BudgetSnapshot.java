package com.tradingarena.common.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Read-only view of the day's inference spend. */
public record BudgetSnapshot(
    LocalDate day,
    long tokensUsed,
    BigDecimal costUsed,
    BigDecimal ceiling,
    BigDecimal remaining,
    double percentUsed
) {}
