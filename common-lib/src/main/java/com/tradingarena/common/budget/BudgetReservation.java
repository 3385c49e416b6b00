package com.tradingarena.common.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of a reservation attempt: either a {@link Grant} holding the reserved amount,
 * or a {@link Denied} carrying the reason. A denial is an expected result, not an error.
 */
public sealed interface BudgetReservation permits BudgetReservation.Grant, BudgetReservation.Denied {

    /**
     * @param day the budget day the reservation was charged to; refunds against a day
     *            that has since rolled over are ignored
     */
    record Grant(String reservationId, BigDecimal cost, long tokens, LocalDate day) implements BudgetReservation {}

    record Denied(DenialReason reason, String detail) implements BudgetReservation {}

    enum DenialReason {
        DAILY_CEILING_EXCEEDED
    }
}
