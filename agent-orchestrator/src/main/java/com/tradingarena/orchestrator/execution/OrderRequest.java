package com.tradingarena.orchestrator.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Market order submitted to the paper brokerage. {@code clientOrderId} carries the
 * decision id so a resubmitted order is recognizable on the broker side.
 */
public record OrderRequest(
    @JsonProperty("symbol")          String symbol,
    @JsonProperty("qty")             String quantity,
    @JsonProperty("side")            String side,
    @JsonProperty("type")            String type,
    @JsonProperty("time_in_force")   String timeInForce,
    @JsonProperty("client_order_id") String clientOrderId
) {

    public static OrderRequest market(String symbol, String quantity, String side, String clientOrderId) {
        return new OrderRequest(symbol, quantity, side, "market", "day", clientOrderId);
    }
}
