package com.tradingarena.common.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Immutable day-scoped inference spend counter. The governor swaps whole instances
 * atomically; nothing mutates a state in place.
 */
public record BudgetState(
    LocalDate day,
    long tokensUsed,
    BigDecimal costUsed,
    BigDecimal ceiling
) {

    public static BudgetState fresh(LocalDate day, BigDecimal ceiling) {
        return new BudgetState(day, 0L, BigDecimal.ZERO, ceiling);
    }

    /** Same state when {@code today} is the current day, a zeroed counter otherwise. */
    public BudgetState rollTo(LocalDate today) {
        return day.equals(today) ? this : fresh(today, ceiling);
    }

    /**
     * A request is admitted only while the ceiling has not been reached and the
     * request itself fits under it.
     */
    public boolean admits(BigDecimal cost) {
        return costUsed.compareTo(ceiling) < 0 && costUsed.add(cost).compareTo(ceiling) <= 0;
    }

    public BudgetState reserve(BigDecimal cost, long tokens) {
        return new BudgetState(day, tokensUsed + tokens, costUsed.add(cost), ceiling);
    }

    public BudgetState release(BigDecimal cost, long tokens) {
        BigDecimal cost0 = costUsed.subtract(cost);
        return new BudgetState(day, Math.max(0L, tokensUsed - tokens),
                               cost0.signum() < 0 ? BigDecimal.ZERO : cost0, ceiling);
    }

    public BudgetState withCeiling(BigDecimal newCeiling) {
        return new BudgetState(day, tokensUsed, costUsed, newCeiling);
    }

    public BudgetSnapshot snapshot() {
        BigDecimal remaining = ceiling.subtract(costUsed).max(BigDecimal.ZERO);
        double percent = ceiling.signum() == 0 ? 100.0 : costUsed.doubleValue() * 100.0 / ceiling.doubleValue();
        return new BudgetSnapshot(day, tokensUsed, costUsed, ceiling, remaining, Math.min(percent, 100.0));
    }
}
