package com.tradingarena.common.risk;

import com.tradingarena.common.model.Position;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Checks a marked position against {@link ExitRules}. Pure function of the position and
 * the rules; the caller remembers whether the partial exit was already taken.
 *
 * <p>Precedence: stop-loss, then full take-profit, then partial take-profit. The partial
 * exit sells whole shares only, so a position too small to split waits for the full
 * take-profit instead.
 */
public final class ExitRuleEvaluator {

    private ExitRuleEvaluator() {}

    public static Optional<ExitSignal> evaluate(Position position, ExitRules rules, boolean partialTaken) {
        if (position.costBasis().signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal gain = gainOf(position);

        if (gain.compareTo(rules.stopLoss().negate()) <= 0) {
            return Optional.of(new ExitSignal(ExitSignal.Reason.STOP_LOSS, position.symbol(),
                                              position.quantity(), gain));
        }
        if (gain.compareTo(rules.takeProfit()) >= 0) {
            return Optional.of(new ExitSignal(ExitSignal.Reason.TAKE_PROFIT, position.symbol(),
                                              position.quantity(), gain));
        }
        if (!partialTaken && gain.compareTo(rules.partialTakeProfit()) >= 0) {
            BigDecimal part = position.quantity().multiply(rules.partialTakeProfitRatio())
                .setScale(0, RoundingMode.DOWN);
            if (part.signum() > 0) {
                return Optional.of(new ExitSignal(ExitSignal.Reason.PARTIAL_TAKE_PROFIT, position.symbol(),
                                                  part.min(position.quantity()), gain));
            }
        }
        return Optional.empty();
    }

    /** Unrealized result over cost basis, six decimal places. */
    public static BigDecimal gainOf(Position position) {
        return position.unrealizedPnl().divide(position.costBasis(), 6, RoundingMode.HALF_UP);
    }
}
