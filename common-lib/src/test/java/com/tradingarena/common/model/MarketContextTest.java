package com.tradingarena.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarketContextTest {

    private static final Instant NOW = Instant.parse("2024-06-03T14:00:00Z");

    private static PriceBar bar(String close) {
        BigDecimal c = new BigDecimal(close);
        return new PriceBar(NOW, c, c, c, c, 1_000);
    }

    @Test
    @DisplayName("later changes to the caller's bar lists do not leak into the context")
    void barsAreCopied() {
        List<PriceBar> series = new ArrayList<>(List.of(bar("50.00")));
        Map<String, List<PriceBar>> bars = new HashMap<>(Map.of("AAPL", series));

        MarketContext context = new MarketContext(SymbolSet.of("AAPL"), bars, Map.of(), null, NOW,
                                                  Duration.ofMinutes(2));
        series.add(bar("99.00"));
        bars.put("MSFT", List.of(bar("400.00")));

        assertEquals(0, new BigDecimal("50.00").compareTo(context.latestClose("AAPL").orElseThrow()));
        assertEquals(1, context.bars().get("AAPL").size());
        assertFalse(context.bars().containsKey("MSFT"));
        assertThrows(UnsupportedOperationException.class, () -> context.bars().get("AAPL").add(bar("1")));
    }

    @Test
    @DisplayName("valid until fetch time plus TTL")
    void validity() {
        MarketContext context = new MarketContext(SymbolSet.of("AAPL"), Map.of(), Map.of(), null, NOW,
                                                  Duration.ofSeconds(60));

        assertTrue(context.isValidAt(NOW.plusSeconds(59)));
        assertFalse(context.isValidAt(NOW.plusSeconds(60)));
    }
}
