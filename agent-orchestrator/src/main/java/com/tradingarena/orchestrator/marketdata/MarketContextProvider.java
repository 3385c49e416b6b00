package com.tradingarena.orchestrator.marketdata;

import com.tradingarena.common.exception.DataUnavailableException;
import com.tradingarena.common.indicator.TechnicalIndicators;
import com.tradingarena.common.model.IndicatorSnapshot;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.NewsDigest;
import com.tradingarena.common.model.PriceBar;
import com.tradingarena.common.model.SymbolSet;
import com.tradingarena.orchestrator.config.ArenaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link MarketContext} snapshots and serves them through {@link MarketContextCache}.
 *
 * <p><strong>Flow on a miss:</strong>
 * <ol>
 *   <li>Fetch bars for every symbol in parallel, each with its own timeout.</li>
 *   <li>Fetch the news digest for the whole set, with its own timeout.</li>
 *   <li>Drop symbols whose bars failed or came back empty; drop news when it failed.</li>
 *   <li>Fail with {@link DataUnavailableException} only when nothing at all came back.</li>
 * </ol>
 */
@Service
public class MarketContextProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketContextProvider.class);

    private final MarketDataSource marketData;
    private final NewsSource news;
    private final MarketContextCache cache;
    private final ArenaProperties.MarketData settings;
    private final ArenaProperties.Timeouts timeouts;
    private final Clock clock;

    public MarketContextProvider(MarketDataSource marketData, NewsSource news, MarketContextCache cache,
                                 ArenaProperties properties, Clock clock) {
        this.marketData = marketData;
        this.news       = news;
        this.cache      = cache;
        this.settings   = properties.marketData();
        this.timeouts   = properties.timeouts();
        this.clock      = clock;
    }

    public Mono<MarketContext> getContext(SymbolSet symbols) {
        return cache.getOrLoad(symbols, this::load);
    }

    private Mono<MarketContext> load(SymbolSet symbols) {
        Mono<Map<String, List<PriceBar>>> bars = Flux.fromIterable(symbols.symbols())
            .flatMap(symbol -> marketData.fetchBars(symbol, settings.timeframe(), settings.barLimit())
                .timeout(timeouts.marketData())
                .filter(series -> !series.isEmpty())
                .map(series -> Map.entry(symbol, series))
                .onErrorResume(e -> {
                    log.warn("MARKET_DATA_UNAVAILABLE symbol={} reason={}", symbol, e.toString());
                    return Mono.empty();
                }))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);

        Mono<Optional<NewsDigest>> digest = news.fetchNews(symbols, settings.newsLimit())
            .timeout(timeouts.news())
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                log.warn("NEWS_UNAVAILABLE symbols={} reason={}", symbols.key(), e.toString());
                return Mono.just(Optional.empty());
            });

        return Mono.zip(bars, digest)
            .flatMap(t -> {
                Map<String, List<PriceBar>> priced = t.getT1();
                NewsDigest newsDigest = t.getT2().orElse(null);
                if (priced.isEmpty() && newsDigest == null) {
                    return Mono.error(new DataUnavailableException(symbols.key(),
                        "every market data and news fetch failed"));
                }
                Map<String, IndicatorSnapshot> indicators = new LinkedHashMap<>();
                priced.forEach((symbol, series) -> indicators.put(symbol, TechnicalIndicators.snapshot(symbol, series)));

                MarketContext ctx = new MarketContext(symbols, priced, indicators, newsDigest,
                                                      clock.instant(), settings.contextTtl());
                log.info("CONTEXT_BUILT symbols={} priced={} news={} ttlSeconds={}",
                         symbols.key(), priced.size(), newsDigest != null, settings.contextTtl().toSeconds());
                return Mono.just(ctx);
            });
    }
}
