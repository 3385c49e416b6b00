package com.tradingarena.orchestrator.marketdata;

import com.tradingarena.common.model.PriceBar;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of OHLCV bars for one symbol.
 */
public interface MarketDataSource {

    /**
     * @return bars oldest-first; an empty list when the symbol has no data
     */
    Mono<List<PriceBar>> fetchBars(String symbol, String timeframe, int limit);
}
