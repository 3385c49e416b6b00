package com.tradingarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable trade decision produced by an agent for one cycle.
 *
 * <p>{@code symbol} is {@code null} only for a HOLD that does not name a symbol.
 * {@code quantity} is {@link BigDecimal#ZERO} for every HOLD. {@code cycleId} is the
 * identifier of the cycle the decision was produced in; the consortium uses it to
 * reject stale input.
 */
public record Decision(
    @JsonProperty("decisionId")   String decisionId,
    @JsonProperty("agentName")    String agentName,
    @JsonProperty("cycleId")      String cycleId,
    @JsonProperty("action")       TradeAction action,
    @JsonProperty("symbol")       String symbol,
    @JsonProperty("quantity")     BigDecimal quantity,
    @JsonProperty("reasoning")    String reasoning,
    @JsonProperty("confidence")   int confidence,
    @JsonProperty("timestamp")    Instant timestamp,
    @JsonProperty("source")       DecisionSource source,
    @JsonProperty("parseFailure") boolean parseFailure
) {

    public Decision {
        Objects.requireNonNull(decisionId, "decisionId");
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within 0..100, got " + confidence);
        }
        if (action == TradeAction.HOLD) {
            quantity = BigDecimal.ZERO;
        } else {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException(action + " decision requires a symbol");
            }
            if (quantity == null || quantity.signum() <= 0) {
                throw new IllegalArgumentException(action + " decision requires a positive quantity");
            }
        }
        if (symbol != null) {
            symbol = symbol.trim().toUpperCase();
        }
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static Decision trade(String agentName, String cycleId, TradeAction action, String symbol,
                                 BigDecimal quantity, String reasoning, int confidence, Instant timestamp) {
        return new Decision(UUID.randomUUID().toString(), agentName, cycleId, action, symbol, quantity,
                            reasoning, confidence, timestamp, DecisionSource.OWN_INFERENCE, false);
    }

    public static Decision hold(String agentName, String cycleId, String symbol, String reasoning,
                                int confidence, Instant timestamp) {
        return new Decision(UUID.randomUUID().toString(), agentName, cycleId, TradeAction.HOLD, symbol,
                            BigDecimal.ZERO, reasoning, confidence, timestamp, DecisionSource.OWN_INFERENCE, false);
    }

    /** Full-confidence SELL raised by an exit rule. */
    public static Decision exit(String agentName, String cycleId, String symbol, BigDecimal quantity,
                                String reasoning, Instant timestamp) {
        return new Decision(UUID.randomUUID().toString(), agentName, cycleId, TradeAction.SELL, symbol, quantity,
                            reasoning, 100, timestamp, DecisionSource.EXIT_RULE, false);
    }

    /** HOLD with confidence 0 for a response that could not be parsed. */
    public static Decision parseFailure(String agentName, String cycleId, String detail, Instant timestamp) {
        return new Decision(UUID.randomUUID().toString(), agentName, cycleId, TradeAction.HOLD, null,
                            BigDecimal.ZERO, "Parse failure, defaulting to HOLD: " + detail, 0, timestamp,
                            DecisionSource.OWN_INFERENCE, true);
    }

    public boolean isTrade() {
        return action.isTrade();
    }
}
