package com.tradingarena.common.model;

import java.math.BigDecimal;

/**
 * Summary of an agent's recent filled trades, fed back into its next prompt.
 */
public record SelfCritique(
    int tradesReviewed,
    int wins,
    int losses,
    BigDecimal realizedPnl,
    BigDecimal fees,
    String worstSymbol,
    String advice
) {

    public String toPromptText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Your last ").append(tradesReviewed).append(" trades: ")
          .append(wins).append(" wins, ").append(losses).append(" losses, realized P&L ")
          .append(realizedPnl.toPlainString()).append(", fees ").append(fees.toPlainString()).append('.');
        if (worstSymbol != null) {
            sb.append(" Weakest symbol: ").append(worstSymbol).append('.');
        }
        sb.append(' ').append(advice);
        return sb.toString();
    }
}
