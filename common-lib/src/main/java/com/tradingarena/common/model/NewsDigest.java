package com.tradingarena.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Headlines gathered for a symbol set, with an optional aggregate sentiment score in
 * [-1.0, +1.0] ({@code null} when the source does not score sentiment).
 */
public record NewsDigest(
    List<String> headlines,
    Double sentimentScore,
    Instant fetchedAt
) {
    public NewsDigest {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
    }

    public boolean isEmpty() {
        return headlines.isEmpty();
    }
}
