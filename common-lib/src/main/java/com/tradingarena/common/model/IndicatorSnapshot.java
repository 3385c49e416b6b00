package com.tradingarena.common.model;

/**
 * Indicator values computed for one symbol at context build time.
 * Numeric fields are {@code null} when there were not enough bars to compute them.
 */
public record IndicatorSnapshot(
    String symbol,
    double lastClose,
    long lastVolume,
    Double changePercent,
    Double rsi14,
    Double sma20,
    Double sma50,
    Double macd,
    Double volatility20,
    String rsiSignal,
    String trendSignal
) {}
