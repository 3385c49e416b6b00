package com.tradingarena.orchestrator.budget;

import com.tradingarena.common.budget.ModelPrice;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.orchestrator.config.ArenaProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Looks up per-model token prices, falling back to the agent's {@link com.tradingarena.common.model.ModelTier}.
 */
@Component
public class InferencePricing {

    private final Map<String, ModelPrice> table;

    public InferencePricing(ArenaProperties properties) {
        this.table = properties.budget().pricing().entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> e.getValue().toModelPrice()));
    }

    public ModelPrice priceFor(AgentProfile agent) {
        ModelPrice price = table.get(agent.modelId());
        return price != null ? price : new ModelPrice(agent.tier().inputPerMillion(), agent.tier().outputPerMillion());
    }

    /** Worst-case cost of one call: the whole prompt in, {@code maxOutputTokens} out. */
    public CostEstimate estimate(AgentProfile agent, String prompt, int maxOutputTokens) {
        long in = ModelPrice.estimateTokens(prompt);
        return new CostEstimate(in, maxOutputTokens, priceFor(agent).cost(in, maxOutputTokens));
    }

    /** Cost of a completed call from reported usage. */
    public BigDecimal actualCost(AgentProfile agent, long promptTokens, long completionTokens) {
        return priceFor(agent).cost(promptTokens, completionTokens);
    }
}
