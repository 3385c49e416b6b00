package com.tradingarena.common.budget;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * USD price per one million input and output tokens for one model.
 */
public record ModelPrice(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
    private static final int COST_SCALE = 8;

    public BigDecimal cost(long inputTokens, long outputTokens) {
        return inputPerMillion.multiply(BigDecimal.valueOf(inputTokens))
            .add(outputPerMillion.multiply(BigDecimal.valueOf(outputTokens)))
            .divide(MILLION, COST_SCALE, RoundingMode.HALF_UP);
    }

    /** Rough token count for a prompt: four characters per token, rounded up. */
    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0L;
        return (text.length() + 3) / 4;
    }
}
