package com.tradingarena.orchestrator.service;

import com.tradingarena.common.exception.DataUnavailableException;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.PortfolioSnapshot;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.DecisionSource;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.AgentLaneExecutor;
import com.tradingarena.orchestrator.execution.BrokerageClient;
import com.tradingarena.orchestrator.execution.ExecutionManager;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.execution.OrderRequest;
import com.tradingarena.orchestrator.execution.OrderResponse;
import com.tradingarena.orchestrator.execution.PendingWriteQueue;
import com.tradingarena.orchestrator.marketdata.MarketContextProvider;
import com.tradingarena.orchestrator.support.ArenaFixtures;
import com.tradingarena.orchestrator.support.InMemoryArenaStore;
import com.tradingarena.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PositionReviewServiceTest {

    private final MutableClock clock = new MutableClock(ArenaFixtures.MARKET_OPEN);
    private final LedgerRegistry registry = new LedgerRegistry();
    private final InMemoryArenaStore store = new InMemoryArenaStore();

    @Mock
    private MarketContextProvider contextProvider;
    @Mock
    private BrokerageClient brokerage;

    private PositionReviewService review;

    @BeforeEach
    void setUp() {
        registry.register(ArenaFixtures.hunter());
        registry.register(ArenaFixtures.analyst());
        AgentLedger afterBuys = new AgentLedger("hunter", ArenaFixtures.CAPITAL, new BigDecimal("7998.00"),
                                                BigDecimal.ZERO, new BigDecimal("2.00"), 2, 0, 0, 2);
        registry.load(afterBuys, List.of(
            new Position("hunter", "AAPL", new BigDecimal("10"), new BigDecimal("500.00"),
                         new BigDecimal("50.00"), BigDecimal.ZERO),
            new Position("hunter", "TSLA", new BigDecimal("5"), new BigDecimal("1500.00"),
                         new BigDecimal("300.00"), BigDecimal.ZERO)));
        review = reviewWith(ArenaFixtures.properties());
    }

    private PositionReviewService reviewWith(ArenaProperties props) {
        AgentLaneExecutor lanes = new AgentLaneExecutor();
        ExecutionManager executions = new ExecutionManager(registry, lanes, brokerage, store, new PendingWriteQueue(),
                                                           props, clock);
        return new PositionReviewService(contextProvider, registry, lanes, executions, store, props, clock);
    }

    private void pricesAt(Map<String, String> closes) {
        when(contextProvider.getContext(any()))
            .thenReturn(Mono.just(ArenaFixtures.context(clock.instant(), closes)));
    }

    private void brokerAccepts() {
        when(brokerage.submitOrder(any())).thenReturn(Mono.just(new OrderResponse("ord", "accepted", null)));
    }

    private List<PortfolioSnapshot> runReview() {
        return review.review().block(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Positions are marked to the latest close; unpriced symbols keep their mark")
    void marksPositions() {
        pricesAt(Map.of("AAPL", "51.00"));

        List<PortfolioSnapshot> snapshots = runReview();

        assertEquals(0, new BigDecimal("51.00").compareTo(registry.position("hunter", "AAPL").lastPrice()));
        assertEquals(0, new BigDecimal("300.00").compareTo(registry.position("hunter", "TSLA").lastPrice()));
        assertEquals(2, store.positions.size());

        assertEquals(List.of("analyst", "hunter"), snapshots.stream().map(PortfolioSnapshot::agentName).toList());
        PortfolioSnapshot hunter = snapshots.get(1);
        assertEquals(0, new BigDecimal("2010.00").compareTo(hunter.positionsValue()));
        assertEquals(0, new BigDecimal("10008.00").compareTo(hunter.totalValue()));
        assertEquals(0, new BigDecimal("10.00").compareTo(hunter.unrealizedProfit()));
        assertEquals(2, hunter.openPositions());
        assertEquals(2, store.snapshots.size());
        verifyNoInteractions(brokerage);
    }

    @Test
    @DisplayName("Cash and ledger counters are never touched by a review")
    void ledgerUntouched() {
        pricesAt(Map.of("AAPL", "49.00"));

        runReview();

        AgentLedger ledger = registry.ledger("hunter");
        assertEquals(0, new BigDecimal("7998.00").compareTo(ledger.cash()));
        assertEquals(2, ledger.pendingCount());
    }

    @Test
    @DisplayName("Missing market data skips the review")
    void noContext() {
        when(contextProvider.getContext(any()))
            .thenReturn(Mono.error(new DataUnavailableException("AAPL,MSFT", "down")));

        assertTrue(runReview().isEmpty());
        assertTrue(store.snapshots.isEmpty());
    }

    @Test
    @DisplayName("Snapshot write failure still returns the in-memory snapshot")
    void storeFailureTolerated() {
        pricesAt(Map.of("AAPL", "51.00"));
        store.failNextWrites(10);

        List<PortfolioSnapshot> snapshots = runReview();

        assertEquals(2, snapshots.size());
        assertEquals(0, new BigDecimal("51.00").compareTo(registry.position("hunter", "AAPL").lastPrice()));
    }

    @Nested
    @DisplayName("Exit rules")
    class Exits {

        @Test
        @DisplayName("A position 4% under entry is sold whole by the stop-loss")
        void stopLoss() {
            pricesAt(Map.of("AAPL", "48.00"));
            brokerAccepts();

            List<PortfolioSnapshot> snapshots = runReview();

            assertNull(registry.position("hunter", "AAPL"));
            assertEquals(0, new BigDecimal("8477.00").compareTo(registry.ledger("hunter").cash()));

            ArgumentCaptor<OrderRequest> order = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerage).submitOrder(order.capture());
            assertEquals("AAPL", order.getValue().symbol());
            assertEquals("10", order.getValue().quantity());
            assertEquals("sell", order.getValue().side());

            TradeRecord sell = store.tradesOf("hunter").get(0);
            assertEquals(TradeAction.SELL, sell.action());
            assertEquals(0, new BigDecimal("-20.00").compareTo(sell.realizedPnl()));
            assertEquals(DecisionSource.EXIT_RULE, store.decisions.get(0).source());
            assertTrue(store.decisions.get(0).reasoning().startsWith("STOP_LOSS"));

            PortfolioSnapshot hunter = snapshots.get(1);
            assertEquals(1, hunter.openPositions());
        }

        @Test
        @DisplayName("The partial take-profit sells half once, the full take-profit sells the rest")
        void partialThenFull() {
            brokerAccepts();
            pricesAt(Map.of("TSLA", "320.00"));

            runReview();
            assertEquals(0, new BigDecimal("3").compareTo(registry.position("hunter", "TSLA").quantity()));

            runReview();
            assertEquals(0, new BigDecimal("3").compareTo(registry.position("hunter", "TSLA").quantity()));
            verify(brokerage, times(1)).submitOrder(any());

            pricesAt(Map.of("TSLA", "330.00"));
            runReview();

            assertNull(registry.position("hunter", "TSLA"));
            verify(brokerage, times(2)).submitOrder(any());
            assertEquals(List.of(TradeAction.SELL, TradeAction.SELL),
                         store.tradesOf("hunter").stream().map(TradeRecord::action).toList());
        }

        @Test
        @DisplayName("With exits disabled the review only marks")
        void exitsDisabled() {
            ArenaProperties.Risk off = new ArenaProperties.Risk(false, null, null, null, null, null, null, null);
            review = reviewWith(ArenaFixtures.properties(null, null, off));
            pricesAt(Map.of("AAPL", "40.00"));

            runReview();

            assertEquals(0, new BigDecimal("40.00").compareTo(registry.position("hunter", "AAPL").lastPrice()));
            verifyNoInteractions(brokerage);
        }
    }
}
