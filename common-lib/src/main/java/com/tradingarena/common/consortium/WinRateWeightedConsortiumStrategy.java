package com.tradingarena.common.consortium;

import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.DecisionSource;
import com.tradingarena.common.model.TradeAction;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link ConsortiumAggregator} weighting each vote by the voter's win rate times its confidence.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Keep only OWN_INFERENCE decisions tagged with {@code cycleId}.</li>
 *   <li>For every symbol named by a vote, tally {@code winRate × confidence} per action.
 *       A vote for symbol X takes part only in the X contest; a HOLD without a symbol adds
 *       its weight to HOLD in every contest.</li>
 *   <li>Each contest is won by the heaviest action. Any tie at the top yields HOLD.</li>
 *   <li>Among contests won by BUY or SELL the heaviest winner is taken; a tie between
 *       two symbols' winners yields HOLD.</li>
 *   <li>Quantity is copied from the heaviest voter behind the winner, ties broken by agent name.</li>
 * </ol>
 *
 * <pre>
 *   BUY(conf 80, winRate .6) = 48, SELL(90, .3) = 27, HOLD(50, .5) = 25   →  BUY, confidence 48
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
public class WinRateWeightedConsortiumStrategy implements ConsortiumAggregator {

    static final double EPSILON = 1e-9;

    private final String consortiumName;
    private final double defaultWinRate;

    public WinRateWeightedConsortiumStrategy(String consortiumName, double defaultWinRate) {
        this.consortiumName = Objects.requireNonNull(consortiumName, "consortiumName");
        if (defaultWinRate < 0.0 || defaultWinRate > 1.0) {
            throw new IllegalArgumentException("defaultWinRate must be within [0, 1], got " + defaultWinRate);
        }
        this.defaultWinRate = defaultWinRate;
    }

    @Override
    public ConsortiumResult aggregate(String cycleId, List<Decision> latestDecisions, Map<String, Double> winRates) {
        List<Decision> current = latestDecisions.stream()
            .filter(d -> cycleId.equals(d.cycleId()))
            .filter(d -> d.source() == DecisionSource.OWN_INFERENCE)
            .filter(d -> !consortiumName.equals(d.agentName()))
            .sorted(Comparator.comparing(Decision::agentName))
            .toList();
        int stale = latestDecisions.size() - current.size();

        Instant timestamp = latestDecisions.stream()
            .map(Decision::timestamp)
            .max(Comparator.naturalOrder())
            .orElse(Instant.EPOCH);
        List<String> voters = current.stream().map(Decision::agentName).toList();

        if (current.isEmpty()) {
            return new ConsortiumResult(hold(cycleId, timestamp, 0, "No current-cycle votes to aggregate"),
                                        Map.of(), voters, stale);
        }

        TreeSet<String> symbols = current.stream()
            .map(Decision::symbol)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(TreeSet::new));

        Map<String, Map<TradeAction, Double>> tallies = new TreeMap<>();
        for (String symbol : symbols) {
            Map<TradeAction, Double> tally = new EnumMap<>(TradeAction.class);
            for (TradeAction a : TradeAction.values()) tally.put(a, 0.0);
            for (Decision d : current) {
                boolean counts = symbol.equals(d.symbol())
                    || (d.symbol() == null && d.action() == TradeAction.HOLD);
                if (counts) tally.merge(d.action(), weight(d, winRates), Double::sum);
            }
            tallies.put(symbol, tally);
        }

        // winning trade per contest, HOLD contests dropped
        List<Contest> tradeWinners = new ArrayList<>();
        for (Map.Entry<String, Map<TradeAction, Double>> e : tallies.entrySet()) {
            TradeAction winner = winner(e.getValue());
            if (winner != TradeAction.HOLD) {
                double total = e.getValue().values().stream().mapToDouble(Double::doubleValue).sum();
                tradeWinners.add(new Contest(e.getKey(), winner, e.getValue().get(winner), total));
            }
        }

        if (tradeWinners.isEmpty()) {
            return new ConsortiumResult(hold(cycleId, timestamp, holdConfidence(current, winRates),
                                             "Weighted vote favours HOLD: " + describe(tallies)),
                                        tallies, voters, stale);
        }

        tradeWinners.sort(Comparator.comparingDouble(Contest::weight).reversed());
        if (tradeWinners.size() > 1
                && Math.abs(tradeWinners.get(0).weight() - tradeWinners.get(1).weight()) < EPSILON) {
            return new ConsortiumResult(hold(cycleId, timestamp, holdConfidence(current, winRates),
                                             "Tie between symbols, defaulting to HOLD: " + describe(tallies)),
                                        tallies, voters, stale);
        }

        Contest win = tradeWinners.get(0);
        Decision lead = current.stream()
            .filter(d -> win.symbol().equals(d.symbol()) && d.action() == win.action())
            .sorted(Comparator.comparingDouble((Decision d) -> weight(d, winRates)).reversed()
                              .thenComparing(Decision::agentName))
            .findFirst()
            .orElseThrow();

        int confidence = win.total() <= 0.0 ? 0 : clamp((int) Math.round(100.0 * win.weight() / win.total()));
        Decision decision = new Decision(decisionId(cycleId), consortiumName, cycleId, win.action(), win.symbol(),
                                         lead.quantity(), "Weighted vote: " + describe(tallies), confidence,
                                         timestamp, DecisionSource.AGGREGATED, false);
        return new ConsortiumResult(decision, tallies, voters, stale);
    }

    double weight(Decision d, Map<String, Double> winRates) {
        double winRate = winRates.getOrDefault(d.agentName(), defaultWinRate);
        return winRate * d.confidence();
    }

    private static TradeAction winner(Map<TradeAction, Double> tally) {
        double best = tally.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        List<TradeAction> top = tally.entrySet().stream()
            .filter(e -> Math.abs(e.getValue() - best) < EPSILON)
            .map(Map.Entry::getKey)
            .toList();
        return top.size() == 1 ? top.get(0) : TradeAction.HOLD;
    }

    private int holdConfidence(List<Decision> current, Map<String, Double> winRates) {
        double total = current.stream().mapToDouble(d -> weight(d, winRates)).sum();
        if (total <= 0.0) return 0;
        double hold = current.stream()
            .filter(d -> d.action() == TradeAction.HOLD)
            .mapToDouble(d -> weight(d, winRates))
            .sum();
        return clamp((int) Math.round(100.0 * hold / total));
    }

    private Decision hold(String cycleId, Instant timestamp, int confidence, String reasoning) {
        return new Decision(decisionId(cycleId), consortiumName, cycleId, TradeAction.HOLD, null, BigDecimal.ZERO,
                            reasoning, confidence, timestamp, DecisionSource.AGGREGATED, false);
    }

    private String decisionId(String cycleId) {
        return UUID.nameUUIDFromBytes((consortiumName + ":" + cycleId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String describe(Map<String, Map<TradeAction, Double>> tallies) {
        return tallies.entrySet().stream()
            .map(e -> e.getKey() + " " + e.getValue().entrySet().stream()
                .map(t -> t.getKey() + "=" + String.format(Locale.ROOT, "%.2f", t.getValue()))
                .collect(Collectors.joining("/")))
            .collect(Collectors.joining("; "));
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(100, v));
    }

    private record Contest(String symbol, TradeAction action, double weight, double total) {}
}
