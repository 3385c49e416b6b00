package com.tradingarena.common.consortium;

import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.TradeAction;

import java.util.List;
import java.util.Map;

/**
 * Output of a {@link ConsortiumAggregator} run.
 *
 * <ul>
 *   <li>{@code decision}     the aggregated decision, source AGGREGATED</li>
 *   <li>{@code tallies}      per symbol, the total vote weight of each action</li>
 *   <li>{@code voters}       agents whose decisions took part, sorted by name</li>
 *   <li>{@code staleIgnored} decisions dropped because they belong to another cycle</li>
 * </ul>
 */
public record ConsortiumResult(
    Decision decision,
    Map<String, Map<TradeAction, Double>> tallies,
    List<String> voters,
    int staleIgnored
) {}
