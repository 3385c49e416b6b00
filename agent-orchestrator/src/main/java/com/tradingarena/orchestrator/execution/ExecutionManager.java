package com.tradingarena.orchestrator.execution;

import com.tradingarena.common.exception.ExecutionFailedException;
import com.tradingarena.common.exception.InsufficientResourcesException;
import com.tradingarena.common.exception.StoreWriteException;
import com.tradingarena.common.ledger.LedgerCalculator;
import com.tradingarena.common.ledger.LedgerMutation;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.common.model.TradeStatus;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import com.tradingarena.orchestrator.persistence.ExecutionWrite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Applies decisions to the agents' books and the paper brokerage.
 *
 * <p><strong>Ordering per decision:</strong>
 * <ol>
 *   <li>Idempotency: a decision id already seen in memory or in the store is a DUPLICATE.</li>
 *   <li>HOLD: logged, nothing else.</li>
 *   <li>Pre-trade check against the current books at the context reference price.
 *       A shortfall is recorded as NOT_EXECUTED and no order is sent.</li>
 *   <li>Market order with the decision id as client order id. An error, timeout or
 *       non-accepted status is recorded as FAILED and leaves the books untouched.</li>
 *   <li>Accepted: commit the in-memory books, then persist with retry. A write that
 *       still fails is parked for {@link #drainPendingWrites()}.</li>
 * </ol>
 *
 * <p>All of the above runs inside the agent's lane, so executions for one agent never
 * interleave while different agents proceed in parallel.
 *
 * <p>Once started, an execution runs to completion on its own subscription. A caller that
 * cancels only stops waiting; an order already sent is still committed or recorded as FAILED.
 *
 * <p>Decision ids stay in memory for {@link #SEEN_RETENTION}; older ones are only found
 * through {@link ArenaStore#hasExecuted(String)}.
 */
@Service
public class ExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(ExecutionManager.class);

    static final Duration SEEN_RETENTION = Duration.ofDays(1);

    private final LedgerRegistry registry;
    private final AgentLaneExecutor lanes;
    private final BrokerageClient brokerage;
    private final ArenaStore store;
    private final PendingWriteQueue pendingWrites;
    private final BigDecimal fee;
    private final Duration brokerageTimeout;
    private final ArenaProperties.Store storeSettings;
    private final Clock clock;

    /** Decision id to the instant it was claimed. */
    private final Map<String, Instant> seenDecisions = new ConcurrentHashMap<>();

    public ExecutionManager(LedgerRegistry registry, AgentLaneExecutor lanes, BrokerageClient brokerage,
                            ArenaStore store, PendingWriteQueue pendingWrites, ArenaProperties properties,
                            Clock clock) {
        this.registry         = registry;
        this.lanes            = lanes;
        this.brokerage        = brokerage;
        this.store            = store;
        this.pendingWrites    = pendingWrites;
        this.fee              = properties.execution().fee();
        this.brokerageTimeout = properties.timeouts().brokerage();
        this.storeSettings    = properties.store();
        this.clock            = clock;
    }

    public Mono<ExecutionResult> apply(AgentProfile agent, Decision decision, MarketContext context) {
        if (!agent.name().equals(decision.agentName())) {
            return Mono.error(new IllegalArgumentException("decision " + decision.decisionId()
                + " belongs to " + decision.agentName() + ", not " + agent.name()));
        }
        return Mono.fromFuture(() -> lanes.submit(agent.name(), () -> applyInLane(decision, context)).toFuture(),
                               true);
    }

    private Mono<ExecutionResult> applyInLane(Decision decision, MarketContext context) {
        String agent = decision.agentName();
        String id = decision.decisionId();
        Instant now = clock.instant();
        forgetSeenBefore(now.minus(SEEN_RETENTION));
        if (seenDecisions.containsKey(id)) {
            log.info("EXECUTION_DUPLICATE agent={} decisionId={} source=memory", agent, id);
            return Mono.just(ExecutionResult.duplicate(agent, id));
        }
        return store.hasExecuted(id)
            .onErrorResume(e -> {
                log.warn("Idempotency lookup failed, relying on in-memory record. decisionId={} reason={}",
                         id, e.getMessage());
                return Mono.just(false);
            })
            .flatMap(executed -> {
                if (seenDecisions.putIfAbsent(id, now) != null || Boolean.TRUE.equals(executed)) {
                    log.info("EXECUTION_DUPLICATE agent={} decisionId={} source=store", agent, id);
                    return Mono.just(ExecutionResult.duplicate(agent, id));
                }
                if (decision.action() == TradeAction.HOLD) {
                    return hold(decision);
                }
                return trade(decision, context);
            });
    }

    private Mono<ExecutionResult> hold(Decision decision) {
        log.info("DECISION_HELD agent={} cycleId={} decisionId={} symbol={} parseFailure={}",
                 decision.agentName(), decision.cycleId(), decision.decisionId(), decision.symbol(),
                 decision.parseFailure());
        return withRetry(store.logDecision(decision), decision.agentName())
            .onErrorResume(e -> {
                log.error("STORE_WRITE_FAILED agent={} decisionId={} write=decision_log reason={}",
                          decision.agentName(), decision.decisionId(), e.getMessage());
                return Mono.empty();
            })
            .thenReturn(ExecutionResult.held(decision.agentName(), decision.decisionId()));
    }

    private Mono<ExecutionResult> trade(Decision decision, MarketContext context) {
        String agent = decision.agentName();
        BigDecimal price = context.latestClose(decision.symbol()).orElse(null);
        if (price == null) {
            return notExecuted(decision, null, "no reference price for " + decision.symbol());
        }

        AgentBook book = registry.book(agent);
        LedgerMutation mutation;
        try {
            mutation = LedgerCalculator.apply(book.ledger(), book.positions().get(decision.symbol()),
                                              decision, price, fee);
        } catch (InsufficientResourcesException e) {
            log.warn("INSUFFICIENT_RESOURCES agent={} decisionId={} detail={}",
                     agent, decision.decisionId(), e.getMessage());
            return notExecuted(decision, price, e.getMessage());
        }

        OrderRequest order = OrderRequest.market(decision.symbol(), decision.quantity().toPlainString(),
                                                 decision.action().name().toLowerCase(), decision.decisionId());
        return brokerage.submitOrder(order)
            .timeout(brokerageTimeout)
            .switchIfEmpty(Mono.error(() -> new ExecutionFailedException(agent, decision.decisionId(),
                "empty brokerage response")))
            .flatMap(response -> response.isAccepted()
                ? Mono.just(response)
                : Mono.error(new ExecutionFailedException(agent, decision.decisionId(),
                    "order " + response.id() + " returned status " + response.status())))
            .onErrorMap(e -> !(e instanceof ExecutionFailedException),
                        e -> new ExecutionFailedException(agent, decision.decisionId(), describe(e), e))
            .flatMap(response -> filled(decision, mutation, price, response))
            .onErrorResume(ExecutionFailedException.class, e -> failed(decision, price, e.getMessage()));
    }

    private Mono<ExecutionResult> filled(Decision decision, LedgerMutation mutation, BigDecimal price,
                                         OrderResponse response) {
        registry.commit(mutation.ledger(), decision.symbol(), mutation.position());

        TradeRecord record = new TradeRecord(
            decision.decisionId(), decision.agentName(), decision.cycleId(), decision.action(),
            decision.symbol(), decision.quantity(), price, response.filledAvgPrice(), fee,
            decision.action() == TradeAction.SELL ? mutation.realizedPnl() : null, null,
            TradeStatus.FILLED, response.id(), "order " + response.status(), clock.instant());
        ExecutionWrite write = new ExecutionWrite(mutation.ledger(), decision.symbol(), mutation.position(),
                                                  record, decision, mutation.closingPnl());

        log.info("TRADE_FILLED agent={} decisionId={} action={} symbol={} quantity={} price={} cash={} realized={}",
                 decision.agentName(), decision.decisionId(), decision.action(), decision.symbol(),
                 decision.quantity().toPlainString(), price.toPlainString(),
                 mutation.ledger().cash().toPlainString(), mutation.realizedPnl().toPlainString());
        if (mutation.positionClosed()) {
            log.info("POSITION_CLOSED agent={} symbol={} closingPnl={}",
                     decision.agentName(), decision.symbol(), mutation.closingPnl().toPlainString());
        }

        return withRetry(store.persistExecution(write), decision.agentName())
            .thenReturn(new ExecutionResult(decision.agentName(), decision.decisionId(),
                                            ExecutionResult.Outcome.FILLED, record, record.detail(), true))
            .onErrorResume(e -> {
                log.error("STORE_WRITE_FAILED agent={} decisionId={} write=execution parked={} reason={}",
                          decision.agentName(), decision.decisionId(), pendingWrites.size() + 1, e.getMessage());
                pendingWrites.park(write);
                return Mono.just(new ExecutionResult(decision.agentName(), decision.decisionId(),
                                                     ExecutionResult.Outcome.FILLED, record, record.detail(), false));
            });
    }

    private Mono<ExecutionResult> notExecuted(Decision decision, BigDecimal price, String detail) {
        return recordUnfilled(decision, price, TradeStatus.NOT_EXECUTED, detail, ExecutionResult.Outcome.NOT_EXECUTED);
    }

    private Mono<ExecutionResult> failed(Decision decision, BigDecimal price, String detail) {
        log.warn("EXECUTION_FAILED agent={} decisionId={} symbol={} detail={}",
                 decision.agentName(), decision.decisionId(), decision.symbol(), detail);
        return recordUnfilled(decision, price, TradeStatus.FAILED, detail, ExecutionResult.Outcome.FAILED);
    }

    private Mono<ExecutionResult> recordUnfilled(Decision decision, BigDecimal price, TradeStatus status,
                                                 String detail, ExecutionResult.Outcome outcome) {
        TradeRecord record = new TradeRecord(
            decision.decisionId(), decision.agentName(), decision.cycleId(), decision.action(),
            decision.symbol(), decision.quantity(), price, null, BigDecimal.ZERO, null, null,
            status, null, detail, clock.instant());
        return withRetry(store.appendTradeRecord(record, decision), decision.agentName())
            .thenReturn(new ExecutionResult(decision.agentName(), decision.decisionId(), outcome, record, detail, true))
            .onErrorResume(e -> {
                log.error("STORE_WRITE_FAILED agent={} decisionId={} write=trade_record status={} reason={}",
                          decision.agentName(), decision.decisionId(), status, e.getMessage());
                return Mono.just(new ExecutionResult(decision.agentName(), decision.decisionId(), outcome,
                                                     record, detail, false));
            });
    }

    /**
     * Re-persists parked executions. Each runs in its agent's lane and is refreshed with the
     * agent's current books first, so an older snapshot never overwrites a newer one.
     *
     * @return number of writes that succeeded
     */
    public Mono<Integer> drainPendingWrites() {
        List<ExecutionWrite> parked = pendingWrites.drain();
        if (parked.isEmpty()) {
            return Mono.just(0);
        }
        log.info("PENDING_WRITES_DRAIN count={}", parked.size());
        return Flux.fromIterable(parked)
            .concatMap(write -> lanes.submit(write.agentName(), () -> {
                AgentBook book = registry.book(write.agentName());
                Position latest = book.positions().get(write.symbol());
                return store.persistExecution(write.withBooks(book.ledger(), latest))
                    .thenReturn(1)
                    .onErrorResume(e -> {
                        log.warn("STORE_WRITE_FAILED agent={} decisionId={} write=drain reason={}",
                                 write.agentName(), write.record().decisionId(), e.getMessage());
                        pendingWrites.park(write);
                        return Mono.just(0);
                    });
            }))
            .reduce(0, Integer::sum);
    }

    private void forgetSeenBefore(Instant cutoff) {
        seenDecisions.values().removeIf(claimed -> claimed.isBefore(cutoff));
    }

    int seenDecisionCount() {
        return seenDecisions.size();
    }

    private <T> Mono<T> withRetry(Mono<T> write, String agent) {
        return write
            .retryWhen(Retry.backoff(storeSettings.maxRetries(), storeSettings.initialBackoff()))
            .onErrorMap(e -> new StoreWriteException(agent, "write failed after "
                + storeSettings.maxRetries() + " retries: " + rootMessage(e), e));
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "brokerage timeout";
        }
        return "brokerage error: " + rootMessage(e);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
