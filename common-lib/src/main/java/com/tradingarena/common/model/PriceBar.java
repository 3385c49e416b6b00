package com.tradingarena.common.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OHLCV bar as delivered by the market data source.
 */
public record PriceBar(
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume
) {}
