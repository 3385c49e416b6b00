package com.tradingarena.common.consortium;

import com.tradingarena.common.model.Decision;

import java.util.List;
import java.util.Map;

/**
 * Strategy contract for deriving the consortium's decision from the other agents'
 * decisions of the same cycle.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no inference calls</li>
 *   <li><b>Deterministic</b>: identical input yields an identical decision, id and timestamp included</li>
 * </ul>
 */
public interface ConsortiumAggregator {

    /**
     * @param cycleId         the cycle being aggregated; decisions from any other cycle are ignored
     * @param latestDecisions the most recent decision of each independent agent (may be empty)
     * @param winRates        agent name to win rate in [0, 1]; missing agents use the strategy default
     * @return never {@code null}
     */
    ConsortiumResult aggregate(String cycleId, List<Decision> latestDecisions, Map<String, Double> winRates);
}
