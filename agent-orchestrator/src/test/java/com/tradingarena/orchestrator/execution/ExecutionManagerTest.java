package com.tradingarena.orchestrator.execution;

import com.tradingarena.common.ledger.LedgerCalculator;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.common.model.TradeStatus;
import com.tradingarena.orchestrator.config.ArenaProperties;
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
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExecutionManagerTest {

    private final MutableClock clock = new MutableClock(ArenaFixtures.MARKET_OPEN);
    private final InMemoryArenaStore store = new InMemoryArenaStore();
    private final LedgerRegistry registry = new LedgerRegistry();
    private final PendingWriteQueue pending = new PendingWriteQueue();

    @Mock
    private BrokerageClient brokerage;

    private ExecutionManager manager;

    @BeforeEach
    void setUp() {
        ArenaProperties props = ArenaFixtures.properties(null,
            new ArenaProperties.Timeouts(null, null, null, Duration.ofMillis(200), null));
        registry.register(ArenaFixtures.hunter());
        manager = new ExecutionManager(registry, new AgentLaneExecutor(), brokerage, store, pending, props, clock);
    }

    private static MarketContext priced(String close) {
        return ArenaFixtures.context(ArenaFixtures.MARKET_OPEN, Map.of("AAPL", close));
    }

    private Decision decision(TradeAction action, String qty) {
        return Decision.trade("hunter", "cycle-1", action, "AAPL", new BigDecimal(qty), "test", 70, clock.instant());
    }

    private void brokerAccepts() {
        when(brokerage.submitOrder(any())).thenReturn(Mono.just(new OrderResponse("ord-1", "accepted", null)));
    }

    private ExecutionResult apply(Decision d, MarketContext ctx) {
        return manager.apply(ArenaFixtures.hunter(), d, ctx).block(Duration.ofSeconds(5));
    }

    private static void assertMoney(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            () -> "expected " + expected + " but was " + (actual == null ? "null" : actual.toPlainString()));
    }

    @Nested
    @DisplayName("Filled trades")
    class Filled {

        @Test
        @DisplayName("BUY 10 @ $50 from $10,000 leaves $9,499 and a 10-share position")
        void buy() {
            brokerAccepts();

            ExecutionResult result = apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.FILLED, result.outcome());
            assertTrue(result.persisted());
            AgentLedger ledger = registry.ledger("hunter");
            assertMoney("9499.00", ledger.cash());
            assertEquals(1, ledger.pendingCount());
            assertMoney("10", registry.position("hunter", "AAPL").quantity());
            assertTrue(LedgerCalculator.isBalanced(ledger, registry.positions("hunter")));

            assertMoney("9499.00", store.ledgers.get("hunter").cash());
            TradeRecord record = store.tradesOf("hunter").get(0);
            assertEquals(TradeStatus.FILLED, record.status());
            assertEquals("ord-1", record.brokerOrderId());
        }

        @Test
        @DisplayName("Order carries the decision id as client order id")
        void clientOrderId() {
            brokerAccepts();
            Decision d = decision(TradeAction.BUY, "2");

            apply(d, priced("50.00"));

            ArgumentCaptor<OrderRequest> order = ArgumentCaptor.forClass(OrderRequest.class);
            verify(brokerage).submitOrder(order.capture());
            assertEquals(d.decisionId(), order.getValue().clientOrderId());
            assertEquals("buy", order.getValue().side());
            assertEquals("2", order.getValue().quantity());
            assertEquals("market", order.getValue().type());
        }

        @Test
        @DisplayName("Closing a position attaches the round-trip result to its BUY record")
        void closingPnl() {
            brokerAccepts();
            apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            ExecutionResult sell = apply(decision(TradeAction.SELL, "10"), priced("60.00"));

            assertEquals(ExecutionResult.Outcome.FILLED, sell.outcome());
            assertMoney("100", sell.record().realizedPnl());
            assertNull(registry.position("hunter", "AAPL"));
            assertFalse(store.positions.containsKey("hunter|AAPL"));

            TradeRecord buyRecord = store.tradesOf("hunter").get(0);
            assertEquals(TradeAction.BUY, buyRecord.action());
            assertMoney("100", buyRecord.closingPnl());

            AgentLedger ledger = registry.ledger("hunter");
            assertMoney("10098.00", ledger.cash());
            assertEquals(1, ledger.winningCount());
            assertEquals(0, ledger.pendingCount());
        }
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("The same decision applied twice trades once")
        void duplicateInMemory() {
            brokerAccepts();
            Decision d = decision(TradeAction.BUY, "10");

            apply(d, priced("50.00"));
            ExecutionResult second = apply(d, priced("50.00"));

            assertEquals(ExecutionResult.Outcome.DUPLICATE, second.outcome());
            assertMoney("9499.00", registry.ledger("hunter").cash());
            verify(brokerage, times(1)).submitOrder(any());
        }

        @Test
        @DisplayName("A decision already in the store is not re-executed after a restart")
        void duplicateInStore() {
            Decision d = decision(TradeAction.BUY, "10");
            store.decisions.add(d);

            ExecutionResult result = apply(d, priced("50.00"));

            assertEquals(ExecutionResult.Outcome.DUPLICATE, result.outcome());
            verifyNoInteractions(brokerage);
        }

        @Test
        @DisplayName("In-memory decision ids older than a day are forgotten; the store still catches replays")
        void seenIdsExpire() {
            Decision old = Decision.hold("hunter", "cycle-1", null, "wait", 40, clock.instant());
            apply(old, priced("50.00"));

            clock.advance(ExecutionManager.SEEN_RETENTION.plusHours(1));
            apply(Decision.hold("hunter", "cycle-2", null, "wait", 40, clock.instant()), priced("50.00"));

            assertEquals(1, manager.seenDecisionCount());
            assertEquals(ExecutionResult.Outcome.DUPLICATE, apply(old, priced("50.00")).outcome());
        }
    }

    @Nested
    @DisplayName("Caller cancellation")
    class CallerCancellation {

        @Test
        @DisplayName("A caller that stops waiting mid-order does not lose the fill")
        void fillSurvivesCancelledCaller() throws InterruptedException {
            AtomicInteger ordersSent = new AtomicInteger();
            when(brokerage.submitOrder(any())).thenReturn(Mono.defer(() -> {
                ordersSent.incrementAndGet();
                return Mono.delay(Duration.ofMillis(150))
                    .thenReturn(new OrderResponse("ord-1", "accepted", null));
            }));
            Decision d = decision(TradeAction.BUY, "10");

            Disposable caller = manager.apply(ArenaFixtures.hunter(), d, priced("50.00")).subscribe();
            Thread.sleep(50);
            caller.dispose();

            // queued behind the first execution in the agent's lane
            ExecutionResult again = apply(d, priced("50.00"));

            assertEquals(ExecutionResult.Outcome.DUPLICATE, again.outcome());
            assertEquals(1, ordersSent.get());
            assertMoney("9499.00", registry.ledger("hunter").cash());
            assertEquals(1, store.tradesOf("hunter").size());
            assertEquals(TradeStatus.FILLED, store.tradesOf("hunter").get(0).status());
        }
    }

    @Nested
    @DisplayName("Rejected trades")
    class Rejected {

        @Test
        @DisplayName("Insufficient cash is NOT_EXECUTED and no order is sent")
        void insufficientCash() {
            ExecutionResult result = apply(decision(TradeAction.BUY, "1000"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.NOT_EXECUTED, result.outcome());
            assertEquals(TradeStatus.NOT_EXECUTED, store.tradesOf("hunter").get(0).status());
            assertMoney("10000.00", registry.ledger("hunter").cash());
            verifyNoInteractions(brokerage);
        }

        @Test
        @DisplayName("Selling more than held is NOT_EXECUTED")
        void oversell() {
            ExecutionResult result = apply(decision(TradeAction.SELL, "1"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.NOT_EXECUTED, result.outcome());
            verifyNoInteractions(brokerage);
        }

        @Test
        @DisplayName("A symbol without a reference price is NOT_EXECUTED")
        void noPrice() {
            ExecutionResult result = apply(decision(TradeAction.BUY, "1"),
                                           ArenaFixtures.context(ArenaFixtures.MARKET_OPEN, Map.of("MSFT", "400")));

            assertEquals(ExecutionResult.Outcome.NOT_EXECUTED, result.outcome());
            assertTrue(result.detail().contains("no reference price"));
        }

        @Test
        @DisplayName("Broker rejection is FAILED and leaves the books untouched")
        void brokerRejects() {
            when(brokerage.submitOrder(any())).thenReturn(Mono.just(new OrderResponse("ord-2", "rejected", null)));

            ExecutionResult result = apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.FAILED, result.outcome());
            assertMoney("10000.00", registry.ledger("hunter").cash());
            assertNull(registry.position("hunter", "AAPL"));
            assertEquals(TradeStatus.FAILED, store.tradesOf("hunter").get(0).status());
        }

        @Test
        @DisplayName("Broker error and timeout are FAILED")
        void brokerErrorAndTimeout() {
            when(brokerage.submitOrder(any()))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")))
                .thenReturn(Mono.never());

            ExecutionResult error = apply(decision(TradeAction.BUY, "1"), priced("50.00"));
            ExecutionResult timeout = apply(decision(TradeAction.BUY, "1"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.FAILED, error.outcome());
            assertTrue(error.detail().contains("connection reset"));
            assertEquals(ExecutionResult.Outcome.FAILED, timeout.outcome());
            assertTrue(timeout.detail().contains("timeout"));
            assertMoney("10000.00", registry.ledger("hunter").cash());
        }
    }

    @Nested
    @DisplayName("HOLD")
    class Hold {

        @Test
        @DisplayName("HOLD is logged without touching the books or the broker")
        void hold() {
            Decision d = Decision.hold("hunter", "cycle-1", null, "nothing compelling", 40, clock.instant());

            ExecutionResult result = apply(d, priced("50.00"));

            assertEquals(ExecutionResult.Outcome.HELD, result.outcome());
            assertEquals(1, store.decisions.size());
            assertTrue(store.trades.isEmpty());
            verifyNoInteractions(brokerage);
        }

        @Test
        @DisplayName("A decision for another agent is rejected")
        void wrongAgent() {
            Decision d = Decision.hold("analyst", "cycle-1", null, "", 40, clock.instant());

            assertThrows(IllegalArgumentException.class, () -> apply(d, priced("50.00")));
        }
    }

    @Nested
    @DisplayName("Store outages")
    class StoreOutage {

        @Test
        @DisplayName("Transient write failure is retried")
        void transientFailureRetried() {
            brokerAccepts();
            store.failNextWrites(2);

            ExecutionResult result = apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            assertTrue(result.persisted());
            assertEquals(0, pending.size());
            assertEquals(1, store.tradesOf("hunter").size());
        }

        @Test
        @DisplayName("Exhausted retries park the write; the in-memory books still reflect the fill")
        void parkedThenDrained() {
            brokerAccepts();
            store.failNextWrites(3);

            ExecutionResult result = apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            assertEquals(ExecutionResult.Outcome.FILLED, result.outcome());
            assertFalse(result.persisted());
            assertEquals(1, pending.size());
            assertMoney("9499.00", registry.ledger("hunter").cash());
            assertTrue(store.trades.isEmpty());

            Integer drained = manager.drainPendingWrites().block(Duration.ofSeconds(5));

            assertEquals(1, drained);
            assertEquals(0, pending.size());
            assertMoney("9499.00", store.ledgers.get("hunter").cash());
            assertEquals(1, store.tradesOf("hunter").size());
        }

        @Test
        @DisplayName("Draining writes the latest books, not the parked snapshot")
        void drainUsesLatestBooks() {
            brokerAccepts();
            store.failNextWrites(3);
            apply(decision(TradeAction.BUY, "10"), priced("50.00"));
            apply(decision(TradeAction.BUY, "5"), priced("50.00"));

            manager.drainPendingWrites().block(Duration.ofSeconds(5));

            assertMoney("9248.00", store.ledgers.get("hunter").cash());
            Position stored = store.positions.get("hunter|AAPL");
            assertMoney("15", stored.quantity());
        }

        @Test
        @DisplayName("A parked closing SELL drained after a reopen leaves the new position's BUY open")
        void drainedCloseDoesNotTouchReopenedPosition() {
            brokerAccepts();
            Decision firstBuy = decision(TradeAction.BUY, "10");
            apply(firstBuy, priced("50.00"));

            store.failNextWrites(3);
            apply(decision(TradeAction.SELL, "10"), priced("60.00"));
            assertEquals(1, pending.size());

            clock.advance(Duration.ofMinutes(5));
            Decision reopen = decision(TradeAction.BUY, "5");
            apply(reopen, priced("60.00"));

            manager.drainPendingWrites().block(Duration.ofSeconds(5));

            TradeRecord opened = store.tradesOf("hunter").stream()
                .filter(t -> t.decisionId().equals(firstBuy.decisionId())).findFirst().orElseThrow();
            TradeRecord reopened = store.tradesOf("hunter").stream()
                .filter(t -> t.decisionId().equals(reopen.decisionId())).findFirst().orElseThrow();
            assertMoney("100", opened.closingPnl());
            assertNull(reopened.closingPnl());
            assertMoney("5", store.positions.get("hunter|AAPL").quantity());
        }

        @Test
        @DisplayName("A failing drain keeps the write parked")
        void failedDrainReparks() {
            brokerAccepts();
            store.failNextWrites(3);
            apply(decision(TradeAction.BUY, "10"), priced("50.00"));

            store.failNextWrites(1);
            Integer drained = manager.drainPendingWrites().block(Duration.ofSeconds(5));

            assertEquals(0, drained);
            assertEquals(1, pending.size());
        }
    }
}
