package com.tradingarena.orchestrator.service;

import com.tradingarena.common.budget.BudgetReservation;
import com.tradingarena.common.budget.BudgetState;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Position;
import com.tradingarena.orchestrator.budget.InferenceBudgetGovernor;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.support.ArenaFixtures;
import com.tradingarena.orchestrator.support.InMemoryArenaStore;
import com.tradingarena.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ArenaBootstrapServiceTest {

    private final MutableClock clock = new MutableClock(ArenaFixtures.MARKET_OPEN);
    private final InMemoryArenaStore store = new InMemoryArenaStore();
    private final LedgerRegistry registry = new LedgerRegistry();
    private final ArenaProperties props = ArenaFixtures.properties();
    private final InferenceBudgetGovernor governor = new InferenceBudgetGovernor(props, clock);
    private final ArenaBootstrapService bootstrap = new ArenaBootstrapService(props, registry, store, governor);

    @Test
    @DisplayName("Persisted books are loaded and new agents start with opening ledgers")
    void loadsAndCreates() {
        store.ledgers.put("hunter", new AgentLedger("hunter", ArenaFixtures.CAPITAL, new BigDecimal("9499.00"),
                                                    BigDecimal.ZERO, new BigDecimal("1.00"), 1, 0, 0, 1));
        store.positions.put("hunter|AAPL", new Position("hunter", "AAPL", new BigDecimal("10"),
                                                        new BigDecimal("500.00"), new BigDecimal("50.00"),
                                                        BigDecimal.ZERO));

        bootstrap.bootstrap().block(Duration.ofSeconds(5));

        assertEquals(0, new BigDecimal("9499.00").compareTo(registry.ledger("hunter").cash()));
        assertNotNull(registry.position("hunter", "AAPL"));
        assertEquals(0, ArenaFixtures.CAPITAL.compareTo(registry.ledger("analyst").cash()));
        assertTrue(registry.isRegistered("consortium"));
        assertEquals(4, store.ledgers.size());
    }

    @Test
    @DisplayName("Today's persisted inference spend is restored")
    void restoresBudget() {
        LocalDate today = LocalDate.of(2024, 6, 3);
        store.budgets.put(today, new BudgetState(today, 4_000, new BigDecimal("0.30"), new BigDecimal("0.80")));

        bootstrap.bootstrap().block(Duration.ofSeconds(5));

        assertEquals(0, new BigDecimal("0.30").compareTo(governor.snapshot().costUsed()));
    }

    @Nested
    @DisplayName("Store outage at startup")
    class StoreOutage {

        private final LocalDate today = LocalDate.of(2024, 6, 3);

        @BeforeEach
        void persistedState() {
            store.ledgers.put("hunter", new AgentLedger("hunter", ArenaFixtures.CAPITAL, new BigDecimal("5000.00"),
                                                        BigDecimal.ZERO, new BigDecimal("3.00"), 3, 1, 2, 0));
            store.budgets.put(today, new BudgetState(today, 9_000, new BigDecimal("0.79"), new BigDecimal("0.80")));
        }

        @Test
        @DisplayName("A transient read failure is retried and the persisted books and spend win")
        void transientFailureRetried() {
            store.failNextLoads(1);

            bootstrap.bootstrap().block(Duration.ofSeconds(5));

            assertEquals(0, new BigDecimal("5000.00").compareTo(registry.ledger("hunter").cash()));
            assertInstanceOf(BudgetReservation.Denied.class, governor.tryReserve(new BigDecimal("0.05"), 500));
        }

        @Test
        @DisplayName("A lasting outage fails the bootstrap and writes nothing over the stored ledgers")
        void lastingOutageFails() {
            store.failNextLoads(100);

            assertThrows(RuntimeException.class, () -> bootstrap.bootstrap().block(Duration.ofSeconds(5)));

            assertEquals(1, store.ledgers.size());
            assertEquals(0, new BigDecimal("5000.00").compareTo(store.ledgers.get("hunter").cash()));
        }
    }
}
