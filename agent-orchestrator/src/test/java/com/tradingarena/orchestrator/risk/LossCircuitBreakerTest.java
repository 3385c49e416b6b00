package com.tradingarena.orchestrator.risk;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Position;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.support.ArenaFixtures;
import com.tradingarena.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LossCircuitBreakerTest {

    private final MutableClock clock = new MutableClock(ArenaFixtures.MARKET_OPEN);
    private final LedgerRegistry registry = new LedgerRegistry();
    private LossCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        registry.register(ArenaFixtures.hunter());
        breaker = new LossCircuitBreaker(registry, ArenaFixtures.properties(), clock);
    }

    private void equity(String cash, Position... positions) {
        registry.load(new AgentLedger("hunter", ArenaFixtures.CAPITAL, new BigDecimal(cash), BigDecimal.ZERO,
                                      BigDecimal.ZERO, 0, 0, 0, 0), List.of(positions));
    }

    @Test
    @DisplayName("A 4.99% daily drawdown still trades; 5% pauses the agent until the next day")
    void dailyLimit() {
        assertTrue(breaker.check("hunter").isEmpty());

        equity("9501.00");
        assertTrue(breaker.check("hunter").isEmpty());

        equity("9500.00");
        assertEquals("daily loss 5% reached limit 5%", breaker.check("hunter").orElseThrow());

        equity("10000.00");
        assertTrue(breaker.check("hunter").orElseThrow().startsWith("paused until 2024-06-04"));

        clock.advance(Duration.ofDays(1));
        assertTrue(breaker.check("hunter").isEmpty());
    }

    @Test
    @DisplayName("Open positions count at their last mark")
    void marksCount() {
        breaker.check("hunter");

        equity("9000.00", new Position("hunter", "AAPL", new BigDecimal("10"), new BigDecimal("1000.00"),
                                       new BigDecimal("60.00"), BigDecimal.ZERO));

        assertTrue(breaker.check("hunter").isEmpty());
    }

    @Test
    @DisplayName("Losses spread over the week pause the agent until Monday")
    void weeklyLimit() {
        breaker.check("hunter");
        for (String cash : List.of("9600.00", "9200.00", "8990.00")) {
            clock.advance(Duration.ofDays(1));
            breaker.check("hunter");
            equity(cash);
        }

        assertEquals("weekly loss 10.1% reached limit 10%", breaker.check("hunter").orElseThrow());

        clock.set(Instant.parse("2024-06-10T15:00:00Z"));
        assertTrue(breaker.check("hunter").isEmpty());
    }

    @Test
    @DisplayName("Disabled breaker never opens")
    void disabled() {
        ArenaProperties.Risk off = new ArenaProperties.Risk(null, null, null, null, null, false, null, null);
        breaker = new LossCircuitBreaker(registry, ArenaFixtures.properties(null, null, off), clock);
        breaker.check("hunter");

        equity("5000.00");

        assertTrue(breaker.check("hunter").isEmpty());
    }
}
