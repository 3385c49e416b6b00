package com.tradingarena.common.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Immutable per-agent loss tracking for one day and one week, keyed on the equity the
 * agent held when each window opened. Weeks start on Monday.
 *
 * <p>{@code pausedUntil} is the first day trading is allowed again after a limit was hit,
 * or {@code null} while the breaker is closed.
 */
public record LossWindow(
    LocalDate day,
    BigDecimal dayStartEquity,
    LocalDate weekStart,
    BigDecimal weekStartEquity,
    LocalDate pausedUntil
) {

    public static LossWindow open(LocalDate today, BigDecimal equity) {
        return new LossWindow(today, equity, weekOf(today), equity, null);
    }

    /** Opens a new day and, on a new week, a new week window at {@code equity}. */
    public LossWindow rollTo(LocalDate today, BigDecimal equity) {
        if (day.equals(today)) {
            return this;
        }
        LocalDate week = weekOf(today);
        boolean newWeek = !week.equals(weekStart);
        LocalDate stillPaused = pausedUntil != null && today.isBefore(pausedUntil) ? pausedUntil : null;
        return new LossWindow(today, equity, week, newWeek ? equity : weekStartEquity, stillPaused);
    }

    public boolean isPaused(LocalDate today) {
        return pausedUntil != null && today.isBefore(pausedUntil);
    }

    public BigDecimal dailyLoss(BigDecimal equity) {
        return lossFraction(dayStartEquity, equity);
    }

    public BigDecimal weeklyLoss(BigDecimal equity) {
        return lossFraction(weekStartEquity, equity);
    }

    public LossWindow pauseUntil(LocalDate resume) {
        return new LossWindow(day, dayStartEquity, weekStart, weekStartEquity, resume);
    }

    public LocalDate nextWeek() {
        return weekStart.plusWeeks(1);
    }

    private static BigDecimal lossFraction(BigDecimal start, BigDecimal equity) {
        if (start.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return start.subtract(equity).divide(start, 6, RoundingMode.HALF_UP).max(BigDecimal.ZERO);
    }

    private static LocalDate weekOf(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }
}
