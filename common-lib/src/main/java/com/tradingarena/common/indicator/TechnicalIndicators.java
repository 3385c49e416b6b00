package com.tradingarena.common.indicator;

import com.tradingarena.common.model.IndicatorSnapshot;
import com.tradingarena.common.model.PriceBar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure indicator functions over closing prices.
 * Price lists are newest-first (index 0 = most recent close) unless stated otherwise.
 */
public final class TechnicalIndicators {

    public static final int RSI_PERIOD        = 14;
    public static final int SMA_SHORT         = 20;
    public static final int SMA_LONG          = 50;
    public static final int VOLATILITY_PERIOD = 20;

    private TechnicalIndicators() {}

    // ── Snapshot ────────────────────────────────────────────────────────────

    /**
     * Builds the indicator snapshot the prompt and position review consume.
     *
     * @param bars bars for one symbol, oldest-first as delivered by the data source; must not be empty
     */
    public static IndicatorSnapshot snapshot(String symbol, List<PriceBar> bars) {
        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) closes.add(bar.close().doubleValue());
        Collections.reverse(closes);

        PriceBar last = bars.get(bars.size() - 1);
        double lastClose = closes.get(0);
        double rsi   = rsi(closes, RSI_PERIOD);
        double sma20 = sma(closes, SMA_SHORT);
        double sma50 = sma(closes, SMA_LONG);

        return new IndicatorSnapshot(
            symbol, lastClose, last.volume(),
            orNull(changePercent(closes)),
            orNull(rsi), orNull(sma20), orNull(sma50),
            orNull(macd(closes)),
            orNull(stdDev(closes, VOLATILITY_PERIOD)),
            rsiSignal(rsi),
            trendSignal(sma20, sma50, lastClose));
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI using Wilder's smoothing.
     * @return 0–100, or NaN if there are fewer than {@code period + 1} prices
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;

        List<Double> oldest = oldestFirst(prices);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving averages ─────────────────────────────────────────────────────

    public static double sma(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        return sum / period;
    }

    /** Most recent EMA value, seeded with the oldest price. */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        List<Double> oldest = oldestFirst(prices);
        double k = 2.0 / (period + 1);
        double ema = oldest.get(0);
        for (int i = 1; i < oldest.size(); i++) {
            ema = oldest.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    /** MACD line = EMA(12) − EMA(26). */
    public static double macd(List<Double> prices) {
        double ema12 = ema(prices, 12);
        double ema26 = ema(prices, 26);
        if (Double.isNaN(ema12) || Double.isNaN(ema26)) return Double.NaN;
        return ema12 - ema26;
    }

    // ── Volatility / change ─────────────────────────────────────────────────

    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /** Percent change of the latest close against the previous one. */
    public static double changePercent(List<Double> prices) {
        if (prices == null || prices.size() < 2 || prices.get(1) == 0.0) return Double.NaN;
        return (prices.get(0) - prices.get(1)) * 100.0 / prices.get(1);
    }

    // ── Signal helpers ──────────────────────────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return "INSUFFICIENT_DATA";
        if (rsi < 30) return "OVERSOLD";
        if (rsi > 70) return "OVERBOUGHT";
        return "NEUTRAL";
    }

    public static String trendSignal(double sma20, double sma50, double currentPrice) {
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return "INSUFFICIENT_DATA";
        if (currentPrice > sma20 && sma20 > sma50) return "UPTREND";
        if (currentPrice < sma20 && sma20 < sma50) return "DOWNTREND";
        return "SIDEWAYS";
    }

    private static List<Double> oldestFirst(List<Double> newestFirst) {
        List<Double> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }

    private static Double orNull(double v) {
        return Double.isNaN(v) ? null : v;
    }
}
