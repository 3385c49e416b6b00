package com.tradingarena.orchestrator.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderResponse(
    @JsonProperty("id")               String id,
    @JsonProperty("status")           String status,
    @JsonProperty("filled_avg_price") BigDecimal filledAvgPrice
) {

    private static final Set<String> ACCEPTED =
        Set.of("accepted", "new", "pending_new", "partially_filled", "filled");

    public boolean isAccepted() {
        return status != null && ACCEPTED.contains(status.toLowerCase());
    }
}
