package com.tradingarena.orchestrator.budget;

import com.tradingarena.common.budget.BudgetReservation;
import com.tradingarena.common.budget.BudgetReservation.Denied;
import com.tradingarena.common.budget.BudgetReservation.DenialReason;
import com.tradingarena.common.budget.BudgetReservation.Grant;
import com.tradingarena.common.budget.BudgetSnapshot;
import com.tradingarena.common.budget.BudgetState;
import com.tradingarena.orchestrator.config.ArenaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide daily ceiling on inference spend, shared by every agent.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>A request is granted only if {@code used < ceiling} and {@code used + estimate ≤ ceiling}.</li>
 *   <li>Grants are charged up front; a call that fails before producing a billable response is refunded.</li>
 *   <li>Settlement against actual usage only ever refunds the unused part of a grant.</li>
 *   <li>The counter resets when the day changes in the configured zone.</li>
 * </ul>
 *
 * <p>State is a single immutable {@link BudgetState} swapped by compare-and-set, so concurrent
 * reservations cannot both pass the check against the same remaining amount.
 */
@Component
public class InferenceBudgetGovernor {

    private static final Logger log = LoggerFactory.getLogger(InferenceBudgetGovernor.class);

    private final AtomicReference<BudgetState> state;
    private final Clock clock;
    private final ZoneId zone;

    public InferenceBudgetGovernor(ArenaProperties properties, Clock clock) {
        this.clock = clock;
        this.zone  = properties.budget().zoneId();
        this.state = new AtomicReference<>(BudgetState.fresh(today(), properties.budget().dailyCeiling()));
    }

    public BudgetReservation tryReserve(BigDecimal estimatedCost, long estimatedTokens) {
        if (estimatedCost.signum() < 0) {
            throw new IllegalArgumentException("estimated cost must be non-negative");
        }
        LocalDate today = today();
        while (true) {
            BudgetState current = state.get();
            BudgetState rolled = current.rollTo(today);
            if (!rolled.admits(estimatedCost)) {
                if (rolled != current) {
                    state.compareAndSet(current, rolled);
                }
                log.warn("BUDGET_DENIED day={} requested={} used={} ceiling={}",
                         rolled.day(), estimatedCost.toPlainString(), rolled.costUsed().toPlainString(),
                         rolled.ceiling().toPlainString());
                return new Denied(DenialReason.DAILY_CEILING_EXCEEDED,
                    "used " + rolled.costUsed().toPlainString() + " of " + rolled.ceiling().toPlainString()
                        + ", requested " + estimatedCost.toPlainString());
            }
            BudgetState next = rolled.reserve(estimatedCost, estimatedTokens);
            if (state.compareAndSet(current, next)) {
                Grant grant = new Grant(UUID.randomUUID().toString(), estimatedCost, estimatedTokens, next.day());
                log.info("BUDGET_GRANTED reservationId={} cost={} tokens={} used={} ceiling={}",
                         grant.reservationId(), estimatedCost.toPlainString(), estimatedTokens,
                         next.costUsed().toPlainString(), next.ceiling().toPlainString());
                return grant;
            }
        }
    }

    /** Returns a whole grant. Ignored when the grant belongs to a day that has already rolled over. */
    public void refund(Grant grant) {
        BudgetState after = state.updateAndGet(s ->
            s.day().equals(grant.day()) ? s.release(grant.cost(), grant.tokens()) : s);
        log.info("BUDGET_REFUNDED reservationId={} cost={} used={}",
                 grant.reservationId(), grant.cost().toPlainString(), after.costUsed().toPlainString());
    }

    /**
     * Settles a grant against the usage the provider reported. Usage above the reservation
     * is not charged; usage below it is refunded.
     */
    public void settle(Grant grant, BigDecimal actualCost, long actualTokens) {
        BigDecimal unusedCost = grant.cost().subtract(actualCost);
        long unusedTokens = Math.max(0L, grant.tokens() - actualTokens);
        if (unusedCost.signum() <= 0 && unusedTokens == 0) {
            return;
        }
        BigDecimal refund = unusedCost.max(BigDecimal.ZERO);
        BudgetState after = state.updateAndGet(s ->
            s.day().equals(grant.day()) ? s.release(refund, unusedTokens) : s);
        log.debug("BUDGET_SETTLED reservationId={} reserved={} actual={} used={}",
                  grant.reservationId(), grant.cost().toPlainString(), actualCost.toPlainString(),
                  after.costUsed().toPlainString());
    }

    public BudgetSnapshot updateCeiling(BigDecimal ceiling) {
        if (ceiling == null || ceiling.signum() < 0) {
            throw new IllegalArgumentException("ceiling must be non-negative");
        }
        LocalDate today = today();
        BudgetState after = state.updateAndGet(s -> s.rollTo(today).withCeiling(ceiling));
        log.info("BUDGET_CEILING_UPDATED day={} ceiling={} used={}",
                 after.day(), ceiling.toPlainString(), after.costUsed().toPlainString());
        return after.snapshot();
    }

    public BudgetSnapshot snapshot() {
        return current().snapshot();
    }

    /** Current state rolled to today, for persistence. */
    public BudgetState current() {
        return state.get().rollTo(today());
    }

    /**
     * Restores persisted usage after a restart. Only usage recorded for today is taken,
     * and only when it is higher than what this process has already counted.
     */
    public void restore(BudgetState persisted) {
        LocalDate today = today();
        if (persisted == null || !persisted.day().equals(today)) {
            return;
        }
        BudgetState after = state.updateAndGet(s -> {
            BudgetState rolled = s.rollTo(today);
            return persisted.costUsed().compareTo(rolled.costUsed()) > 0
                ? new BudgetState(today, Math.max(persisted.tokensUsed(), rolled.tokensUsed()),
                                  persisted.costUsed(), rolled.ceiling())
                : rolled;
        });
        log.info("BUDGET_RESTORED day={} used={} tokens={} ceiling={}",
                 after.day(), after.costUsed().toPlainString(), after.tokensUsed(), after.ceiling().toPlainString());
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }
}
