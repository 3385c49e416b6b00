package com.tradingarena.orchestrator.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingarena.common.model.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bars from the Alpaca market data API ({@code GET /v2/stocks/{symbol}/bars}).
 */
@Component
public class AlpacaMarketDataClient implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(AlpacaMarketDataClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public AlpacaMarketDataClient(@Qualifier("marketDataWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<PriceBar>> fetchBars(String symbol, String timeframe, int limit) {
        log.debug("Fetching bars. symbol={} timeframe={} limit={}", symbol, timeframe, limit);
        return webClient.get()
            .uri(uri -> uri.path("/v2/stocks/{symbol}/bars")
                           .queryParam("timeframe", timeframe)
                           .queryParam("limit", limit)
                           .queryParam("adjustment", "raw")
                           .build(symbol))
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parseBars(symbol, json))
            .doOnSuccess(bars -> log.debug("Bars fetched. symbol={} count={}", symbol, bars.size()));
    }

    List<PriceBar> parseBars(String symbol, String json) {
        try {
            JsonNode bars = objectMapper.readTree(json).path("bars");
            List<PriceBar> out = new ArrayList<>();
            if (!bars.isArray()) {
                return out;
            }
            for (JsonNode bar : bars) {
                out.add(new PriceBar(
                    Instant.parse(bar.path("t").asText()),
                    new BigDecimal(bar.path("o").asText()),
                    new BigDecimal(bar.path("h").asText()),
                    new BigDecimal(bar.path("l").asText()),
                    new BigDecimal(bar.path("c").asText()),
                    bar.path("v").asLong()));
            }
            return out;
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable bars payload for " + symbol, e);
        }
    }
}
