package com.tradingarena.common.risk;

import com.tradingarena.common.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExitRuleEvaluatorTest {

    private static final ExitRules RULES = new ExitRules(new BigDecimal("0.03"), new BigDecimal("0.10"),
                                                         new BigDecimal("0.06"), new BigDecimal("0.5"));

    /** AAPL holding marked at {@code price}. */
    private static Position heldAt(String quantity, String costBasis, String price) {
        return new Position("alpha", "AAPL", new BigDecimal(quantity), new BigDecimal(costBasis),
                            new BigDecimal(price), BigDecimal.ZERO);
    }

    @Test
    @DisplayName("$100 entry marked at $97 → stop-loss sells all 10")
    void stopLossAtThreshold() {
        ExitSignal signal = ExitRuleEvaluator.evaluate(heldAt("10", "1000", "97"), RULES, false).orElseThrow();

        assertEquals(ExitSignal.Reason.STOP_LOSS, signal.reason());
        assertEquals(0, new BigDecimal("10").compareTo(signal.quantity()));
        assertEquals(0, new BigDecimal("-0.03").compareTo(signal.gain()));
    }

    @Test
    @DisplayName("Between the thresholds nothing fires")
    void insideBand() {
        assertEquals(Optional.empty(), ExitRuleEvaluator.evaluate(heldAt("10", "1000", "97.01"), RULES, false));
        assertEquals(Optional.empty(), ExitRuleEvaluator.evaluate(heldAt("10", "1000", "105.99"), RULES, false));
    }

    @Test
    @DisplayName("+6% sells half once; after that only the full take-profit fires")
    void partialOnce() {
        ExitSignal partial = ExitRuleEvaluator.evaluate(heldAt("10", "1000", "106"), RULES, false).orElseThrow();
        assertTrue(partial.isPartial());
        assertEquals(0, new BigDecimal("5").compareTo(partial.quantity()));

        assertEquals(Optional.empty(), ExitRuleEvaluator.evaluate(heldAt("5", "500", "106"), RULES, true));

        ExitSignal full = ExitRuleEvaluator.evaluate(heldAt("5", "500", "110"), RULES, true).orElseThrow();
        assertEquals(ExitSignal.Reason.TAKE_PROFIT, full.reason());
        assertEquals(0, new BigDecimal("5").compareTo(full.quantity()));
    }

    @Test
    @DisplayName("A single share cannot be split, so the partial exit waits")
    void partialNeedsWholeShare() {
        assertEquals(Optional.empty(), ExitRuleEvaluator.evaluate(heldAt("1", "100", "107"), RULES, false));
    }

    @Test
    @DisplayName("The full take-profit wins over the partial one")
    void fullBeatsPartial() {
        ExitSignal signal = ExitRuleEvaluator.evaluate(heldAt("10", "1000", "115"), RULES, false).orElseThrow();

        assertEquals(ExitSignal.Reason.TAKE_PROFIT, signal.reason());
        assertEquals(0, new BigDecimal("10").compareTo(signal.quantity()));
    }

    @Test
    @DisplayName("Ratio above one is rejected")
    void invalidRules() {
        assertThrows(IllegalArgumentException.class,
            () -> new ExitRules(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, new BigDecimal("1.2")));
    }
}
