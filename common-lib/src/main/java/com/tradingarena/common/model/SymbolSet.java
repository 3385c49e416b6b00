package com.tradingarena.common.model;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Normalised, order-independent set of ticker symbols. Two sets holding the same
 * tickers in any order or case share one {@link #key()} and therefore one cache entry.
 */
public record SymbolSet(List<String> symbols) {

    public SymbolSet {
        symbols = symbols.stream()
            .filter(Objects::nonNull)
            .map(s -> s.trim().toUpperCase())
            .filter(s -> !s.isEmpty())
            .distinct()
            .sorted()
            .toList();
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("symbol set must not be empty");
        }
    }

    public static SymbolSet of(Collection<String> symbols) {
        return new SymbolSet(List.copyOf(symbols));
    }

    public static SymbolSet of(String... symbols) {
        return new SymbolSet(List.of(symbols));
    }

    public String key() {
        return String.join(",", symbols);
    }

    public boolean contains(String symbol) {
        return symbol != null && symbols.contains(symbol.trim().toUpperCase());
    }
}
