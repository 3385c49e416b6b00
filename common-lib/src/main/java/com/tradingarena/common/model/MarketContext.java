package com.tradingarena.common.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable market snapshot for a {@link SymbolSet}.
 *
 * <p>{@code bars} and {@code indicators} only hold symbols whose bars could be fetched;
 * {@code news} is {@code null} when the news source was unavailable. A refresh builds a
 * new instance, it never mutates this one.
 */
public record MarketContext(
    SymbolSet symbols,
    Map<String, List<PriceBar>> bars,
    Map<String, IndicatorSnapshot> indicators,
    NewsDigest news,
    Instant fetchedAt,
    Duration ttl
) {

    public MarketContext {
        bars = bars.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
        indicators = Map.copyOf(indicators);
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(fetchedAt.plus(ttl));
    }

    public boolean hasNews() {
        return news != null && !news.isEmpty();
    }

    /** Close of the most recent bar for {@code symbol}, if the symbol was priced. */
    public Optional<BigDecimal> latestClose(String symbol) {
        if (symbol == null) return Optional.empty();
        List<PriceBar> series = bars.get(symbol.trim().toUpperCase());
        if (series == null || series.isEmpty()) return Optional.empty();
        return Optional.of(series.get(series.size() - 1).close());
    }

    /** Symbols that actually carry price data in this snapshot. */
    public List<String> pricedSymbols() {
        return symbols.symbols().stream().filter(bars::containsKey).toList();
    }
}
