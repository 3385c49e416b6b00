package com.tradingarena.common.risk;

import java.math.BigDecimal;

/**
 * An exit rule that fired for one position.
 *
 * @param quantity shares to sell, never more than the position holds
 * @param gain     unrealized result as a fraction of cost basis when the rule fired
 */
public record ExitSignal(Reason reason, String symbol, BigDecimal quantity, BigDecimal gain) {

    public enum Reason { STOP_LOSS, TAKE_PROFIT, PARTIAL_TAKE_PROFIT }

    public boolean isPartial() {
        return reason == Reason.PARTIAL_TAKE_PROFIT;
    }
}
