package com.tradingarena.orchestrator.config;

import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.ModelTier;
import com.tradingarena.common.model.StrategyVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArenaPropertiesTest {

    @Test
    @DisplayName("Empty configuration yields three agents, a consortium and trading disabled")
    void defaults() {
        ArenaProperties props = ArenaProperties.defaults();

        assertFalse(props.tradingEnabled());
        List<AgentProfile> profiles = props.profiles();
        assertEquals(List.of("hunter", "analyst", "strategist", "consortium"),
                     profiles.stream().map(AgentProfile::name).toList());
        assertTrue(profiles.get(3).consortium());
        assertEquals(0, new BigDecimal("0.80").compareTo(props.budget().dailyCeiling()));
        assertEquals("America/New_York", props.budget().zoneId().getId());
        assertEquals(ModelTier.PREMIUM, profiles.get(2).tier());
    }

    @Test
    @DisplayName("Universe symbols are trimmed, upper-cased and de-duplicated")
    void universeSanitized() {
        ArenaProperties props = new ArenaProperties(true, null, null, Arrays.asList(" aapl", "AAPL", null, "msft", ""),
                                                    null, null, null, null, null, null, null, null);

        assertEquals(List.of("AAPL", "MSFT"), props.universe());
    }

    @Test
    @DisplayName("Duplicate agent names are rejected")
    void duplicateNames() {
        List<ArenaProperties.Agent> agents = List.of(
            new ArenaProperties.Agent("alpha", StrategyVariant.HUNTER, "m1", null, null),
            new ArenaProperties.Agent("alpha", StrategyVariant.ANALYST, "m2", null, null));

        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties(true, agents, null, null, null, null, null, null, null, null, null, null));
    }

    @Test
    @DisplayName("Consortium may not share a name with an agent")
    void consortiumNameClash() {
        List<ArenaProperties.Agent> agents = List.of(
            new ArenaProperties.Agent("consortium", StrategyVariant.HUNTER, "m1", null, null));

        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties(true, agents, null, null, null, null, null, null, null, null, null, null));
    }

    @Test
    @DisplayName("Negative ceiling and zero critique interval are rejected")
    void invalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties.Budget(new BigDecimal("-0.01"), null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties.Decision(0, null, null, null, null, null));
    }

    @Test
    @DisplayName("Risk defaults follow the exit and loss-limit fractions")
    void riskDefaults() {
        ArenaProperties.Risk risk = ArenaProperties.defaults().risk();

        assertTrue(risk.exitsEnabled());
        assertEquals(0, new BigDecimal("0.03").compareTo(risk.exitRules().stopLoss()));
        assertEquals(0, new BigDecimal("0.5").compareTo(risk.exitRules().partialTakeProfitRatio()));
        assertEquals(0, new BigDecimal("0.05").compareTo(risk.dailyLossLimit()));
        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties.Risk(null, null, null, null, new BigDecimal("1.5"), null, null, null)
                .exitRules());
        assertThrows(IllegalArgumentException.class,
            () -> new ArenaProperties.Risk(null, null, null, null, null, null, BigDecimal.ZERO, null));
    }
}
