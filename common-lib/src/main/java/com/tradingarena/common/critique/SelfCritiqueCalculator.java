package com.tradingarena.common.critique;

import com.tradingarena.common.model.SelfCritique;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.common.model.TradeRecord;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summarizes an agent's own recent filled trades without any inference call.
 *
 * <p>The summary only moves forward every {@code everyN} filled trades: with 7 fills and
 * N = 5 the newest two are left out, so the critique reflects the state at the 5th fill
 * until the 10th fill lands. Of the remaining fills, the newest {@code window} are reviewed.
 *
 * <p>Outcome per record: a SELL counts as a win when its realized P&amp;L is positive,
 * otherwise as a loss; BUY records carry no outcome until they close.
 */
public final class SelfCritiqueCalculator {

    private SelfCritiqueCalculator() {}

    /**
     * @param newestFirst the agent's trade records, newest first; non-FILLED records are ignored
     * @param everyN      critique cadence in filled trades, at least 1
     * @param window      maximum number of fills reviewed
     * @return empty when fewer than {@code everyN} trades have filled
     */
    public static Optional<SelfCritique> summarize(List<TradeRecord> newestFirst, int everyN, int window) {
        if (everyN < 1) throw new IllegalArgumentException("everyN must be >= 1");
        List<TradeRecord> filled = newestFirst.stream().filter(TradeRecord::isFilled).toList();
        if (filled.size() < everyN) return Optional.empty();

        int skip = filled.size() % everyN;
        List<TradeRecord> reviewed = filled.subList(skip, Math.min(filled.size(), skip + window));

        int wins = 0;
        int losses = 0;
        BigDecimal pnl = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        Map<String, BigDecimal> bySymbol = new HashMap<>();
        for (TradeRecord r : reviewed) {
            fees = fees.add(r.fee() == null ? BigDecimal.ZERO : r.fee());
            if (r.action() == TradeAction.SELL && r.realizedPnl() != null) {
                if (r.realizedPnl().signum() > 0) wins++;
                else losses++;
                pnl = pnl.add(r.realizedPnl());
                bySymbol.merge(r.symbol(), r.realizedPnl(), BigDecimal::add);
            }
        }

        String worst = bySymbol.entrySet().stream()
            .filter(e -> e.getValue().signum() < 0)
            .min(Map.Entry.<String, BigDecimal>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .orElse(null);

        return Optional.of(new SelfCritique(reviewed.size(), wins, losses, pnl, fees, worst,
                                            advice(wins, losses, pnl, fees, reviewed.size())));
    }

    static String advice(int wins, int losses, BigDecimal pnl, BigDecimal fees, int reviewed) {
        if (wins + losses == 0) {
            return "None of these trades has been closed yet; avoid adding exposure until existing positions resolve.";
        }
        if (pnl.compareTo(fees) < 0) {
            return "Fees are outweighing realized gains; trade less often and only on strong signals.";
        }
        if (losses > wins) {
            return "Losses outnumber wins; tighten entry criteria and cut losing positions sooner.";
        }
        if (reviewed >= 8 && wins + losses <= reviewed / 4) {
            return "Most trades are still open; make sure each position has a clear exit plan.";
        }
        return "The recent approach is working; keep position sizes disciplined.";
    }
}
