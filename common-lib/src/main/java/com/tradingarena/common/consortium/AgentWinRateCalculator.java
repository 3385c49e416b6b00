package com.tradingarena.common.consortium;

import com.tradingarena.common.model.AgentLedger;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts agent ledgers into the win rates used as consortium vote weights.
 *
 * <pre>
 *   resolved &lt; minResolved  →  defaultWinRate
 *   otherwise                →  winning / (winning + losing)
 * </pre>
 */
public final class AgentWinRateCalculator {

    private AgentWinRateCalculator() {}

    public static Map<String, Double> compute(Collection<AgentLedger> ledgers, int minResolved,
                                              double defaultWinRate) {
        Map<String, Double> rates = new HashMap<>();
        for (AgentLedger ledger : ledgers) {
            Double rate = ledger.winRate();
            rates.put(ledger.agentName(),
                      rate == null || ledger.resolvedCount() < minResolved ? defaultWinRate : rate);
        }
        return rates;
    }
}
