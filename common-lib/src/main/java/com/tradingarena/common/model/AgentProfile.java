package com.tradingarena.common.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Static configuration of one competing agent.
 *
 * <p>{@code variant} and {@code modelId} are {@code null} for the consortium agent,
 * which never calls the inference provider.
 */
public record AgentProfile(
    String name,
    StrategyVariant variant,
    String modelId,
    ModelTier tier,
    BigDecimal initialCapital,
    boolean consortium
) {
    public AgentProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initialCapital, "initialCapital");
        if (initialCapital.signum() < 0) {
            throw new IllegalArgumentException("initialCapital must be non-negative for agent " + name);
        }
        if (!consortium && (variant == null || modelId == null || modelId.isBlank())) {
            throw new IllegalArgumentException("inference agent " + name + " requires a variant and a model id");
        }
        if (tier == null) {
            tier = variant != null ? variant.defaultTier() : ModelTier.ECONOMY;
        }
    }

    public static AgentProfile inference(String name, StrategyVariant variant, String modelId,
                                         BigDecimal initialCapital) {
        return new AgentProfile(name, variant, modelId, variant.defaultTier(), initialCapital, false);
    }

    public static AgentProfile consortium(String name, BigDecimal initialCapital) {
        return new AgentProfile(name, null, null, null, initialCapital, true);
    }
}
