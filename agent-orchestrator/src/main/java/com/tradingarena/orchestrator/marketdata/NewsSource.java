package com.tradingarena.orchestrator.marketdata;

import com.tradingarena.common.model.NewsDigest;
import com.tradingarena.common.model.SymbolSet;
import reactor.core.publisher.Mono;

/**
 * Source of recent headlines for a symbol set. Failures only degrade the context.
 */
public interface NewsSource {

    Mono<NewsDigest> fetchNews(SymbolSet symbols, int limit);
}
