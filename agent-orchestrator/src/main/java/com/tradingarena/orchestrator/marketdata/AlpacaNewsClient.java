package com.tradingarena.orchestrator.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingarena.common.model.NewsDigest;
import com.tradingarena.common.model.SymbolSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Headlines from the Alpaca news API ({@code GET /v1beta1/news}). The API does not score
 * sentiment, so the digest's sentiment is always {@code null}.
 */
@Component
public class AlpacaNewsClient implements NewsSource {

    private static final Logger log = LoggerFactory.getLogger(AlpacaNewsClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AlpacaNewsClient(@Qualifier("newsWebClient") WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Mono<NewsDigest> fetchNews(SymbolSet symbols, int limit) {
        return webClient.get()
            .uri(uri -> uri.path("/v1beta1/news")
                           .queryParam("symbols", symbols.key())
                           .queryParam("limit", limit)
                           .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(this::parseHeadlines)
            .map(headlines -> new NewsDigest(headlines, null, clock.instant()))
            .doOnSuccess(d -> log.debug("News fetched. symbols={} headlines={}", symbols.key(), d.headlines().size()));
    }

    private List<String> parseHeadlines(String json) {
        try {
            List<String> headlines = new ArrayList<>();
            for (JsonNode item : objectMapper.readTree(json).path("news")) {
                String headline = item.path("headline").asText("");
                if (!headline.isBlank()) {
                    headlines.add(headline.trim());
                }
            }
            return headlines;
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable news payload", e);
        }
    }
}
