package com.tradingarena.orchestrator.support;

import com.tradingarena.common.indicator.TechnicalIndicators;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.IndicatorSnapshot;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.NewsDigest;
import com.tradingarena.common.model.PriceBar;
import com.tradingarena.common.model.StrategyVariant;
import com.tradingarena.common.model.SymbolSet;
import com.tradingarena.orchestrator.config.ArenaProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ArenaFixtures {

    /** Monday 2024-06-03 15:00 UTC, 11:00 in New York: regular session. */
    public static final Instant MARKET_OPEN = Instant.parse("2024-06-03T15:00:00Z");

    public static final BigDecimal CAPITAL = new BigDecimal("10000.00");

    private ArenaFixtures() {}

    /** Enabled arena on AAPL and MSFT with fast store retries. */
    public static ArenaProperties properties() {
        return properties(null, null);
    }

    public static ArenaProperties properties(ArenaProperties.Budget budget, ArenaProperties.Timeouts timeouts) {
        return properties(budget, timeouts, null);
    }

    public static ArenaProperties properties(ArenaProperties.Budget budget, ArenaProperties.Timeouts timeouts,
                                             ArenaProperties.Risk risk) {
        return new ArenaProperties(true, null, null, List.of("AAPL", "MSFT"), null, budget, null, null, timeouts,
                                   new ArenaProperties.Store(2, Duration.ofMillis(1)), null, risk);
    }

    public static ArenaProperties.Budget ceiling(String amount) {
        return new ArenaProperties.Budget(new BigDecimal(amount), null, null);
    }

    public static AgentProfile hunter() {
        return AgentProfile.inference("hunter", StrategyVariant.HUNTER, "x-ai/grok-3-mini", CAPITAL);
    }

    public static AgentProfile analyst() {
        return AgentProfile.inference("analyst", StrategyVariant.ANALYST, "deepseek/deepseek-chat", CAPITAL);
    }

    public static AgentProfile strategist() {
        return AgentProfile.inference("strategist", StrategyVariant.STRATEGIST, "openai/gpt-4o", CAPITAL);
    }

    public static AgentProfile consortium() {
        return AgentProfile.consortium("consortium", CAPITAL);
    }

    /** Context with one bar per listed symbol, closing at the given price. */
    public static MarketContext context(Instant at, Map<String, String> closes) {
        Map<String, List<PriceBar>> bars = new LinkedHashMap<>();
        closes.forEach((symbol, close) -> bars.put(symbol, List.of(bar(at, new BigDecimal(close)))));
        Map<String, IndicatorSnapshot> indicators = new LinkedHashMap<>();
        bars.forEach((symbol, series) -> indicators.put(symbol, TechnicalIndicators.snapshot(symbol, series)));
        return new MarketContext(SymbolSet.of(closes.keySet()), bars, indicators,
                                 new NewsDigest(List.of("Chipmakers rally on earnings"), null, at),
                                 at, Duration.ofMinutes(2));
    }

    public static PriceBar bar(Instant at, BigDecimal close) {
        return new PriceBar(at, close, close, close, close, 1_000L);
    }
}
