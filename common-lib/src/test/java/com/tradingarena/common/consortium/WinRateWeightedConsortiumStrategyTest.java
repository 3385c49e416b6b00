package com.tradingarena.common.consortium;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.DecisionSource;
import com.tradingarena.common.model.TradeAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WinRateWeightedConsortiumStrategyTest {

    private static final String CYCLE = "cycle-42";
    private static final Instant T0 = Instant.parse("2024-06-03T14:00:00Z");

    private final WinRateWeightedConsortiumStrategy strategy =
        new WinRateWeightedConsortiumStrategy("consortium", 0.5);

    private static Decision vote(String agent, TradeAction action, String symbol, String qty, int confidence) {
        return vote(agent, CYCLE, action, symbol, qty, confidence, T0);
    }

    private static Decision vote(String agent, String cycle, TradeAction action, String symbol, String qty,
                                 int confidence, Instant at) {
        return new Decision(agent + "-" + cycle, agent, cycle, action, symbol, new BigDecimal(qty), "r",
                            confidence, at, DecisionSource.OWN_INFERENCE, false);
    }

    @Nested
    @DisplayName("weighted vote")
    class WeightedVote {

        @Test
        @DisplayName("BUY(80, .6) SELL(90, .3) HOLD(50, .5) on one symbol → 48/27/25 → BUY")
        void referenceScenario() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "10", 80),
                vote("analyst", TradeAction.SELL, "AAPL", "5", 90),
                vote("strategist", TradeAction.HOLD, "AAPL", "0", 50));
            Map<String, Double> rates = Map.of("hunter", 0.6, "analyst", 0.3, "strategist", 0.5);

            ConsortiumResult result = strategy.aggregate(CYCLE, votes, rates);

            Map<TradeAction, Double> tally = result.tallies().get("AAPL");
            assertEquals(48.0, tally.get(TradeAction.BUY), 1e-9);
            assertEquals(27.0, tally.get(TradeAction.SELL), 1e-9);
            assertEquals(25.0, tally.get(TradeAction.HOLD), 1e-9);

            Decision d = result.decision();
            assertEquals(TradeAction.BUY, d.action());
            assertEquals("AAPL", d.symbol());
            assertEquals(0, new BigDecimal("10").compareTo(d.quantity()));
            assertEquals(48, d.confidence());
            assertEquals(DecisionSource.AGGREGATED, d.source());
            assertEquals("consortium", d.agentName());
            assertEquals(CYCLE, d.cycleId());
        }

        @Test
        @DisplayName("agents without a known win rate use the default")
        void defaultWinRate() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "3", 60),
                vote("analyst", TradeAction.SELL, "AAPL", "2", 40));

            ConsortiumResult result = strategy.aggregate(CYCLE, votes, Map.of());

            assertEquals(30.0, result.tallies().get("AAPL").get(TradeAction.BUY), 1e-9);
            assertEquals(TradeAction.BUY, result.decision().action());
        }

        @Test
        @DisplayName("quantity comes from the heaviest voter behind the winner")
        void quantityFromHeaviestVoter() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "3", 60),
                vote("analyst", TradeAction.BUY, "AAPL", "7", 90),
                vote("strategist", TradeAction.SELL, "AAPL", "1", 50));

            Decision d = strategy.aggregate(CYCLE, votes, Map.of()).decision();

            assertEquals(0, new BigDecimal("7").compareTo(d.quantity()));
        }
    }

    @Nested
    @DisplayName("tie-breaking")
    class Ties {

        @Test
        @DisplayName("BUY and SELL with equal weight → HOLD")
        void buySellTie() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "1", 50),
                vote("analyst", TradeAction.SELL, "AAPL", "1", 50));

            assertEquals(TradeAction.HOLD, strategy.aggregate(CYCLE, votes, Map.of()).decision().action());
        }

        @Test
        @DisplayName("equal winners on two different symbols → HOLD")
        void crossSymbolTie() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "1", 50),
                vote("analyst", TradeAction.BUY, "MSFT", "1", 50));

            Decision d = strategy.aggregate(CYCLE, votes, Map.of()).decision();

            assertEquals(TradeAction.HOLD, d.action());
            assertNull(d.symbol());
        }

        @Test
        @DisplayName("heavier winner across symbols is chosen")
        void crossSymbolHeavierWins() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "2", 80),
                vote("analyst", TradeAction.SELL, "MSFT", "1", 50));

            Decision d = strategy.aggregate(CYCLE, votes, Map.of()).decision();

            assertEquals(TradeAction.BUY, d.action());
            assertEquals("AAPL", d.symbol());
            assertEquals(100, d.confidence());
        }

        @Test
        @DisplayName("a HOLD without a symbol weighs against every symbol contest")
        void symbolLessHoldCountsEverywhere() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "2", 40),
                new Decision("s-1", "strategist", CYCLE, TradeAction.HOLD, null, BigDecimal.ZERO, "wait", 60, T0,
                             DecisionSource.OWN_INFERENCE, false));

            ConsortiumResult result = strategy.aggregate(CYCLE, votes, Map.of());

            assertEquals(30.0, result.tallies().get("AAPL").get(TradeAction.HOLD), 1e-9);
            assertEquals(TradeAction.HOLD, result.decision().action());
            assertEquals(60, result.decision().confidence());
        }
    }

    @Nested
    @DisplayName("input filtering and determinism")
    class Filtering {

        @Test
        @DisplayName("decisions from another cycle are ignored and counted as stale")
        void staleDecisionsIgnored() {
            List<Decision> votes = List.of(
                vote("hunter", "cycle-41", TradeAction.SELL, "AAPL", "9", 100, T0.minusSeconds(1800)),
                vote("analyst", TradeAction.BUY, "AAPL", "1", 40));

            ConsortiumResult result = strategy.aggregate(CYCLE, votes, Map.of());

            assertEquals(1, result.staleIgnored());
            assertEquals(List.of("analyst"), result.voters());
            assertEquals(TradeAction.BUY, result.decision().action());
        }

        @Test
        @DisplayName("aggregated decisions, including its own, never vote")
        void aggregatedDecisionsIgnored() {
            Decision ownPrevious = new Decision("c-1", "consortium", CYCLE, TradeAction.SELL, "AAPL",
                                                BigDecimal.ONE, "r", 100, T0, DecisionSource.AGGREGATED, false);

            ConsortiumResult result = strategy.aggregate(CYCLE,
                List.of(ownPrevious, vote("analyst", TradeAction.BUY, "AAPL", "1", 40)), Map.of());

            assertEquals(TradeAction.BUY, result.decision().action());
        }

        @Test
        @DisplayName("no current votes → HOLD with confidence 0")
        void emptyInput() {
            Decision d = strategy.aggregate(CYCLE, List.of(), Map.of()).decision();

            assertEquals(TradeAction.HOLD, d.action());
            assertEquals(0, d.confidence());
        }

        @Test
        @DisplayName("identical input yields an identical decision, id and timestamp included")
        void deterministic() {
            List<Decision> votes = List.of(
                vote("hunter", TradeAction.BUY, "AAPL", "10", 80),
                vote("analyst", "cycle-42", TradeAction.SELL, "AAPL", "5", 90, T0.plusSeconds(5)),
                vote("strategist", TradeAction.HOLD, "AAPL", "0", 50));
            Map<String, Double> rates = Map.of("hunter", 0.6, "analyst", 0.3);

            Decision first = strategy.aggregate(CYCLE, votes, rates).decision();
            Decision second = strategy.aggregate(CYCLE, List.of(votes.get(2), votes.get(0), votes.get(1)), rates)
                                      .decision();

            assertEquals(first, second);
            assertEquals(T0.plusSeconds(5), first.timestamp());
        }

        @Test
        @DisplayName("different cycles produce different decision ids")
        void idDerivedFromCycle() {
            Decision a = strategy.aggregate("cycle-a", List.of(), Map.of()).decision();
            Decision b = strategy.aggregate("cycle-b", List.of(), Map.of()).decision();

            assertNotEquals(a.decisionId(), b.decisionId());
        }
    }

    @Test
    @DisplayName("win rate falls back to the default until enough trades have resolved")
    void winRateCalculator() {
        AgentLedger fresh = new AgentLedger("hunter", BigDecimal.TEN, BigDecimal.TEN,
            BigDecimal.ZERO, BigDecimal.ZERO, 2, 2, 0, 0);
        AgentLedger seasoned = new AgentLedger("analyst", BigDecimal.TEN, BigDecimal.TEN,
            BigDecimal.ZERO, BigDecimal.ZERO, 4, 1, 3, 0);

        Map<String, Double> rates = AgentWinRateCalculator.compute(List.of(fresh, seasoned), 3, 0.5);

        assertEquals(0.5, rates.get("hunter"), 1e-9);
        assertEquals(0.25, rates.get("analyst"), 1e-9);
    }
}
