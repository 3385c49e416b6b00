package com.tradingarena.orchestrator.execution;

import com.tradingarena.common.exception.UnknownAgentException;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative in-memory books of every agent.
 *
 * <p>Readers get consistent snapshots ({@link AgentBook} is immutable). Writers are the
 * execution manager and the position review, both of which run inside the agent's lane,
 * so at most one writer touches a given agent at any time.
 */
@Component
public class LedgerRegistry {

    private static final Logger log = LoggerFactory.getLogger(LedgerRegistry.class);

    private final ConcurrentHashMap<String, AgentBook> books = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AgentProfile> profiles = new ConcurrentHashMap<>();

    /** Registers an agent with an opening ledger unless books for it are already loaded. */
    public void register(AgentProfile profile) {
        profiles.put(profile.name(), profile);
        books.computeIfAbsent(profile.name(),
            name -> new AgentBook(AgentLedger.opening(name, profile.initialCapital()), Map.of()));
    }

    /** Replaces an agent's books with persisted state. */
    public void load(AgentLedger ledger, Collection<Position> positions) {
        Map<String, Position> bySymbol = new TreeMap<>();
        for (Position p : positions) {
            bySymbol.put(p.symbol(), p);
        }
        books.put(ledger.agentName(), new AgentBook(ledger, bySymbol));
        log.info("LEDGER_LOADED agent={} cash={} positions={} trades={}",
                 ledger.agentName(), ledger.cash().toPlainString(), bySymbol.size(), ledger.tradeCount());
    }

    public boolean isRegistered(String agentName) {
        return profiles.containsKey(agentName);
    }

    public AgentProfile profile(String agentName) {
        AgentProfile profile = profiles.get(agentName);
        if (profile == null) {
            throw new UnknownAgentException(agentName);
        }
        return profile;
    }

    public List<AgentProfile> profiles() {
        List<AgentProfile> all = new ArrayList<>(profiles.values());
        all.sort(Comparator.comparing(AgentProfile::name));
        return all;
    }

    public AgentBook book(String agentName) {
        AgentBook book = books.get(agentName);
        if (book == null) {
            throw new UnknownAgentException(agentName);
        }
        return book;
    }

    public AgentLedger ledger(String agentName) {
        return book(agentName).ledger();
    }

    public Collection<Position> positions(String agentName) {
        return book(agentName).positions().values();
    }

    public Position position(String agentName, String symbol) {
        return book(agentName).positions().get(symbol);
    }

    public List<AgentLedger> ledgers() {
        return books.values().stream()
            .map(AgentBook::ledger)
            .sorted(Comparator.comparing(AgentLedger::agentName))
            .toList();
    }

    /** Applies a filled trade. {@code position} is {@code null} when the trade closed it. */
    public AgentBook commit(AgentLedger next, String symbol, Position position) {
        return books.compute(next.agentName(), (name, current) -> {
            if (current == null) {
                throw new UnknownAgentException(name);
            }
            return current.withTrade(next, symbol, position);
        });
    }

    public AgentBook replacePositions(String agentName, Map<String, Position> marked) {
        return books.compute(agentName, (name, current) -> {
            if (current == null) {
                throw new UnknownAgentException(name);
            }
            return current.withPositions(marked);
        });
    }

    /** Cash plus every open position at its last mark. */
    public BigDecimal portfolioValue(String agentName) {
        AgentBook book = book(agentName);
        return book.positions().values().stream()
            .map(Position::marketValue)
            .reduce(book.ledger().cash(), BigDecimal::add);
    }
}
