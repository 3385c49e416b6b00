package com.tradingarena.orchestrator.ai;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.IndicatorSnapshot;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.SelfCritique;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;

/**
 * Assembles the bounded prompt for one agent decision.
 *
 * <p>Sections, in order: portfolio, market data, news, self-critique, fee statement, response
 * contract. When the user prompt exceeds {@code maxChars} the news section is dropped first,
 * then the market table is truncated; the response contract is always kept.
 */
public final class PromptBuilder {

    private PromptBuilder() {}

    public static Prompt build(AgentProfile agent, AgentLedger ledger, Collection<Position> positions,
                               MarketContext context, SelfCritique critique, BigDecimal fee, int maxChars) {
        String system = agent.variant().persona() + "\n\n"
            + "Risk profile: " + agent.variant().riskProfile() + ". "
            + "You trade US equities with simulated capital against other agents. "
            + "You may only sell shares you hold; short selling is not allowed.";

        String portfolio = portfolioSection(ledger, positions);
        String market    = marketSection(context);
        String news      = newsSection(context);
        String review    = critique == null ? "" : "\nSELF-REVIEW\n" + critique.toPromptText() + "\n";
        String fees      = "\nFEES\nEvery executed BUY or SELL costs a flat fee of $" + fee.toPlainString()
            + ". Only trade when the expected gain clearly exceeds the fee.\n";
        String contract  = contractSection();

        String fixed = portfolio + review + fees + contract;
        String user = portfolio + market + news + review + fees + contract;
        if (user.length() > maxChars) {
            user = portfolio + market + review + fees + contract;
        }
        if (user.length() > maxChars) {
            int room = Math.max(0, maxChars - fixed.length());
            user = portfolio + truncate(market, room) + review + fees + contract;
        }
        return new Prompt(system, user);
    }

    private static String portfolioSection(AgentLedger ledger, Collection<Position> positions) {
        StringBuilder sb = new StringBuilder("PORTFOLIO\n");
        sb.append("Cash: $").append(money(ledger.cash())).append('\n');
        sb.append("Realized P&L: $").append(money(ledger.realizedProfit()))
          .append("  Fees paid: $").append(money(ledger.totalFees())).append('\n');
        sb.append("Trades: ").append(ledger.tradeCount())
          .append(" (wins ").append(ledger.winningCount())
          .append(", losses ").append(ledger.losingCount())
          .append(", open ").append(ledger.pendingCount()).append(")\n");
        if (positions.isEmpty()) {
            sb.append("Positions: none\n");
        } else {
            sb.append("Positions:\n");
            for (Position p : positions) {
                sb.append(String.format(Locale.ROOT, "  - %-6s qty=%s avgEntry=%s last=%s unrealized=%s%n",
                    p.symbol(), p.quantity().toPlainString(), money(p.averageEntryPrice()),
                    money(p.lastPrice()), money(p.unrealizedPnl())));
            }
        }
        return sb.toString();
    }

    private static String marketSection(MarketContext context) {
        StringBuilder sb = new StringBuilder("\nMARKET DATA (as of ").append(context.fetchedAt()).append(")\n");
        for (String symbol : context.symbols().symbols()) {
            IndicatorSnapshot s = context.indicators().get(symbol);
            if (s == null) {
                sb.append("  ").append(symbol).append(": no data available, do not trade it this cycle\n");
                continue;
            }
            sb.append(String.format(Locale.ROOT,
                "  %-6s close=%.2f change=%s%% volume=%d rsi14=%s sma20=%s sma50=%s macd=%s vol20=%s rsiSignal=%s trend=%s%n",
                symbol, s.lastClose(), num(s.changePercent()), s.lastVolume(), num(s.rsi14()), num(s.sma20()),
                num(s.sma50()), num(s.macd()), num(s.volatility20()), s.rsiSignal(), s.trendSignal()));
        }
        return sb.toString();
    }

    private static String newsSection(MarketContext context) {
        if (!context.hasNews()) {
            return "\nNEWS\nNo news available.\n";
        }
        StringBuilder sb = new StringBuilder("\nNEWS\n");
        context.news().headlines().forEach(h -> sb.append("  - ").append(h).append('\n'));
        if (context.news().sentimentScore() != null) {
            sb.append(String.format(Locale.ROOT, "Aggregate sentiment: %.2f%n", context.news().sentimentScore()));
        }
        return sb.toString();
    }

    private static String contractSection() {
        return """

            RESPONSE
            Reply with ONE JSON object and nothing else:
            {"decision": "BUY|SELL|HOLD", "symbol": "<ticker or null for HOLD>", "quantity": <shares, 0 for HOLD>, \
            "reasoning": "<short rationale>", "confidence": <0-100>}
            Only use symbols listed under MARKET DATA. Quantity must fit your cash (BUY) or holding (SELL).
            """;
    }

    private static String truncate(String text, int room) {
        if (text.length() <= room) return text;
        if (room <= 4) return "";
        return text.substring(0, room - 4) + "...\n";
    }

    private static String money(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String num(Double v) {
        return v == null ? "n/a" : String.format(Locale.ROOT, "%.2f", v);
    }
}
