package com.tradingarena.orchestrator.service;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.PortfolioSnapshot;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.SymbolSet;
import com.tradingarena.common.risk.ExitRuleEvaluator;
import com.tradingarena.common.risk.ExitRules;
import com.tradingarena.common.risk.ExitSignal;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.AgentBook;
import com.tradingarena.orchestrator.execution.AgentLaneExecutor;
import com.tradingarena.orchestrator.execution.ExecutionManager;
import com.tradingarena.orchestrator.execution.ExecutionResult;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.marketdata.MarketContextProvider;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks every open position to the latest context price, applies the exit rules and records
 * a portfolio snapshot per agent. No inference is involved.
 *
 * <p>Marks and snapshots are applied inside each agent's lane so they never race an
 * execution. A symbol missing from the context keeps its previous mark.
 *
 * <p>An exit that fires becomes a SELL decision executed through {@link ExecutionManager},
 * so it follows the same ledger, idempotency and persistence path as an agent's own trade.
 * The partial take-profit fires once per position; buying more of the symbol re-arms it.
 */
@Service
public class PositionReviewService {

    private static final Logger log = LoggerFactory.getLogger(PositionReviewService.class);

    private final MarketContextProvider contextProvider;
    private final LedgerRegistry registry;
    private final AgentLaneExecutor lanes;
    private final ExecutionManager executionManager;
    private final ArenaStore store;
    private final SymbolSet universe;
    private final boolean exitsEnabled;
    private final ExitRules exitRules;
    private final Clock clock;

    /** agent|symbol to the quantity left after the partial take-profit filled. */
    private final Map<String, BigDecimal> partialTaken = new ConcurrentHashMap<>();

    public PositionReviewService(MarketContextProvider contextProvider, LedgerRegistry registry,
                                 AgentLaneExecutor lanes, ExecutionManager executionManager, ArenaStore store,
                                 ArenaProperties properties, Clock clock) {
        this.contextProvider  = contextProvider;
        this.registry         = registry;
        this.lanes            = lanes;
        this.executionManager = executionManager;
        this.store            = store;
        this.universe         = properties.universeSet();
        this.exitsEnabled     = properties.risk().exitsEnabled();
        this.exitRules        = properties.risk().exitRules();
        this.clock            = clock;
    }

    /** @return the snapshots taken, one per registered agent, sorted by agent name */
    public Mono<List<PortfolioSnapshot>> review() {
        String reviewId = "review-" + UUID.randomUUID();
        return contextProvider.getContext(universe)
            .flatMap(context -> Flux.fromIterable(registry.profiles())
                .flatMap(agent -> reviewAgent(agent, context, reviewId))
                .collectSortedList((a, b) -> a.agentName().compareTo(b.agentName())))
            .doOnNext(snapshots -> log.info("POSITION_REVIEW agents={} openPositions={}", snapshots.size(),
                snapshots.stream().mapToInt(PortfolioSnapshot::openPositions).sum()))
            .onErrorResume(e -> {
                log.warn("Position review skipped. reason={}", e.getMessage());
                return Mono.just(List.of());
            });
    }

    private Mono<PortfolioSnapshot> reviewAgent(AgentProfile agent, MarketContext context, String reviewId) {
        String name = agent.name();
        return lanes.submit(name, () -> mark(name, context))
            .flatMapMany(marked -> Flux.fromIterable(exitsFor(name, marked)))
            .concatMap(exit -> applyExit(agent, exit, context, reviewId))
            .then(lanes.submit(name, () -> snapshot(name)));
    }

    private Mono<Collection<Position>> mark(String agent, MarketContext context) {
        AgentBook book = registry.book(agent);
        Map<String, Position> marked = new TreeMap<>();
        for (Position position : book.positions().values()) {
            Position next = context.latestClose(position.symbol())
                .map(position::markTo)
                .orElse(position);
            marked.put(next.symbol(), next);
        }
        registry.replacePositions(agent, marked);
        partialTaken.keySet().removeIf(key -> key.startsWith(agent + "|")
            && !marked.containsKey(key.substring(agent.length() + 1)));

        if (marked.isEmpty()) {
            return Mono.just(List.of());
        }
        return store.savePositions(new ArrayList<>(marked.values()))
            .onErrorResume(e -> {
                log.warn("STORE_WRITE_FAILED agent={} write=review_marks reason={}", agent, e.getMessage());
                return Mono.empty();
            })
            .thenReturn(marked.values());
    }

    private List<ExitSignal> exitsFor(String agent, Collection<Position> marked) {
        if (!exitsEnabled) {
            return List.of();
        }
        List<ExitSignal> exits = new ArrayList<>();
        for (Position position : marked) {
            BigDecimal leftAfterPartial = partialTaken.get(key(agent, position.symbol()));
            boolean taken = leftAfterPartial != null && leftAfterPartial.compareTo(position.quantity()) == 0;
            ExitRuleEvaluator.evaluate(position, exitRules, taken).ifPresent(exits::add);
        }
        return exits;
    }

    private Mono<ExecutionResult> applyExit(AgentProfile agent, ExitSignal exit, MarketContext context,
                                            String reviewId) {
        String reasoning = exit.reason() + " at " + exit.gain().movePointRight(2).stripTrailingZeros().toPlainString()
            + "% from entry";
        Decision decision = Decision.exit(agent.name(), reviewId, exit.symbol(), exit.quantity(), reasoning,
                                          clock.instant());
        log.info("EXIT_TRIGGERED agent={} symbol={} reason={} quantity={} gain={} decisionId={}",
                 agent.name(), exit.symbol(), exit.reason(), exit.quantity().toPlainString(),
                 exit.gain().toPlainString(), decision.decisionId());
        return executionManager.apply(agent, decision, context)
            .doOnNext(result -> {
                if (exit.isPartial() && result.isFilled()) {
                    Position left = registry.position(agent.name(), exit.symbol());
                    if (left != null) {
                        partialTaken.put(key(agent.name(), exit.symbol()), left.quantity());
                    }
                }
            })
            .onErrorResume(e -> {
                log.error("Exit execution error. agent={} symbol={} error={}", agent.name(), exit.symbol(),
                          e.toString());
                return Mono.empty();
            });
    }

    private Mono<PortfolioSnapshot> snapshot(String agent) {
        PortfolioSnapshot snapshot = snapshotOf(registry.book(agent));
        return store.appendSnapshot(snapshot)
            .onErrorResume(e -> {
                log.warn("STORE_WRITE_FAILED agent={} write=review reason={}", agent, e.getMessage());
                return Mono.empty();
            })
            .thenReturn(snapshot);
    }

    private static String key(String agent, String symbol) {
        return agent + "|" + symbol;
    }

    PortfolioSnapshot snapshotOf(AgentBook book) {
        AgentLedger ledger = book.ledger();
        BigDecimal positionsValue = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        for (Position p : book.positions().values()) {
            positionsValue = positionsValue.add(p.marketValue());
            unrealized = unrealized.add(p.unrealizedPnl());
        }
        return new PortfolioSnapshot(ledger.agentName(), ledger.cash(), positionsValue,
                                     ledger.cash().add(positionsValue), ledger.realizedProfit(), unrealized,
                                     ledger.totalFees(), book.positions().size(), clock.instant());
    }
}
