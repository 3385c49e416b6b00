package com.tradingarena.orchestrator.execution;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Position;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable pair of an agent's ledger and its open positions keyed by symbol.
 */
public record AgentBook(AgentLedger ledger, Map<String, Position> positions) {

    public AgentBook {
        positions = Collections.unmodifiableMap(new TreeMap<>(positions));
    }

    public AgentBook withTrade(AgentLedger next, String symbol, Position position) {
        Map<String, Position> copy = new TreeMap<>(positions);
        if (position == null) {
            copy.remove(symbol);
        } else {
            copy.put(symbol, position);
        }
        return new AgentBook(next, copy);
    }

    public AgentBook withPositions(Map<String, Position> marked) {
        return new AgentBook(ledger, marked);
    }
}
