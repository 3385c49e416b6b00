package com.tradingarena.common.model;

import java.math.BigDecimal;

/**
 * Coarse cost class of an inference model. Carries fallback USD prices per one million
 * tokens, used when the configured pricing table has no entry for a model id.
 */
public enum ModelTier {
    ECONOMY(new BigDecimal("0.14"), new BigDecimal("0.28")),
    STANDARD(new BigDecimal("0.30"), new BigDecimal("0.50")),
    PREMIUM(new BigDecimal("2.50"), new BigDecimal("10.00"));

    private final BigDecimal inputPerMillion;
    private final BigDecimal outputPerMillion;

    ModelTier(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        this.inputPerMillion = inputPerMillion;
        this.outputPerMillion = outputPerMillion;
    }

    public BigDecimal inputPerMillion()  { return inputPerMillion; }
    public BigDecimal outputPerMillion() { return outputPerMillion; }
}
