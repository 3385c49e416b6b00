package com.tradingarena.common.ledger;

import com.tradingarena.common.exception.InsufficientResourcesException;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeAction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Pure ledger arithmetic for filled trades.
 *
 * <h3>BUY</h3>
 * <pre>
 *   cost  = quantity × price
 *   total = cost + fee            must be ≤ cash
 *   cash -= total, costBasis += cost, tradeCount++, pendingCount++
 * </pre>
 *
 * <h3>SELL</h3>
 * <pre>
 *   quantity must be ≤ held quantity
 *   released = costBasis                         (full exit)
 *            = costBasis × quantity / held        (partial exit, scale 8)
 *   realized = quantity × price − released
 *   cash    += quantity × price − fee            must stay ≥ 0
 *   realized > 0 → winningCount++, otherwise losingCount++
 *   a SELL resolves one pending BUY when any is pending, otherwise it counts as a new trade
 * </pre>
 *
 * Both branches keep {@code tradeCount == winning + losing + pending} and
 * {@code cash + Σ costBasis == initial + realized − fees}.
 *
 * <p>Stateless; the caller is responsible for serializing calls per agent.
 */
public final class LedgerCalculator {

    private static final int BASIS_SCALE = 8;

    private LedgerCalculator() {}

    /**
     * Applies a BUY or SELL decision at {@code price}.
     *
     * @param ledger   the agent's current ledger
     * @param position the agent's current position in the decision's symbol, or {@code null}
     * @param decision a BUY or SELL decision
     * @param price    reference price per share
     * @param fee      flat fee charged for the trade
     * @throws InsufficientResourcesException when cash or holdings do not cover the trade
     */
    public static LedgerMutation apply(AgentLedger ledger, Position position, Decision decision,
                                       BigDecimal price, BigDecimal fee) {
        if (decision.action() == TradeAction.HOLD) {
            throw new IllegalArgumentException("HOLD decisions do not mutate the ledger");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("reference price must be positive for " + decision.symbol());
        }
        return decision.action() == TradeAction.BUY
            ? buy(ledger, position, decision, price, fee)
            : sell(ledger, position, decision, price, fee);
    }

    private static LedgerMutation buy(AgentLedger ledger, Position position, Decision decision,
                                      BigDecimal price, BigDecimal fee) {
        BigDecimal cost  = decision.quantity().multiply(price);
        BigDecimal total = cost.add(fee);
        if (total.compareTo(ledger.cash()) > 0) {
            throw new InsufficientResourcesException(ledger.agentName(),
                "BUY " + decision.quantity().toPlainString() + " " + decision.symbol()
                    + " needs " + total.toPlainString() + " but cash is " + ledger.cash().toPlainString());
        }

        AgentLedger next = new AgentLedger(
            ledger.agentName(), ledger.initialCapital(),
            ledger.cash().subtract(total),
            ledger.realizedProfit(),
            ledger.totalFees().add(fee),
            ledger.tradeCount() + 1,
            ledger.winningCount(), ledger.losingCount(),
            ledger.pendingCount() + 1);

        Position nextPosition = position == null
            ? new Position(ledger.agentName(), decision.symbol(), decision.quantity(), cost, price, BigDecimal.ZERO)
            : new Position(ledger.agentName(), decision.symbol(),
                           position.quantity().add(decision.quantity()),
                           position.costBasis().add(cost), price, position.realizedSinceOpen());

        return new LedgerMutation(next, nextPosition, BigDecimal.ZERO, false, null);
    }

    private static LedgerMutation sell(AgentLedger ledger, Position position, Decision decision,
                                       BigDecimal price, BigDecimal fee) {
        BigDecimal held = position == null ? BigDecimal.ZERO : position.quantity();
        if (decision.quantity().compareTo(held) > 0) {
            throw new InsufficientResourcesException(ledger.agentName(),
                "SELL " + decision.quantity().toPlainString() + " " + decision.symbol()
                    + " exceeds holding of " + held.toPlainString());
        }

        BigDecimal proceeds = decision.quantity().multiply(price);
        BigDecimal cashAfter = ledger.cash().add(proceeds).subtract(fee);
        if (cashAfter.signum() < 0) {
            throw new InsufficientResourcesException(ledger.agentName(),
                "SELL " + decision.symbol() + " would leave cash negative after fee " + fee.toPlainString());
        }

        boolean closes = decision.quantity().compareTo(held) == 0;
        BigDecimal released = closes
            ? position.costBasis()
            : position.costBasis().multiply(decision.quantity())
                      .divide(held, BASIS_SCALE, RoundingMode.HALF_UP);
        BigDecimal realized = proceeds.subtract(released);
        boolean win = realized.signum() > 0;
        boolean resolvesPending = ledger.pendingCount() > 0;

        AgentLedger next = new AgentLedger(
            ledger.agentName(), ledger.initialCapital(),
            cashAfter,
            ledger.realizedProfit().add(realized),
            ledger.totalFees().add(fee),
            resolvesPending ? ledger.tradeCount() : ledger.tradeCount() + 1,
            win ? ledger.winningCount() + 1 : ledger.winningCount(),
            win ? ledger.losingCount() : ledger.losingCount() + 1,
            resolvesPending ? ledger.pendingCount() - 1 : ledger.pendingCount());

        BigDecimal roundTrip = position.realizedSinceOpen().add(realized);
        if (closes) {
            return new LedgerMutation(next, null, realized, true, roundTrip);
        }
        Position remaining = new Position(ledger.agentName(), decision.symbol(),
                                          held.subtract(decision.quantity()),
                                          position.costBasis().subtract(released), price, roundTrip);
        return new LedgerMutation(next, remaining, realized, false, null);
    }

    /**
     * Checks {@code cash + Σ costBasis == initial + realized − fees}.
     */
    public static boolean isBalanced(AgentLedger ledger, Collection<Position> positions) {
        BigDecimal basis = positions.stream().map(Position::costBasis).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal lhs = ledger.cash().add(basis);
        BigDecimal rhs = ledger.initialCapital().add(ledger.realizedProfit()).subtract(ledger.totalFees());
        return lhs.compareTo(rhs) == 0;
    }
}
