package com.tradingarena.orchestrator.service;

import com.tradingarena.common.consortium.AgentWinRateCalculator;
import com.tradingarena.common.consortium.ConsortiumAggregator;
import com.tradingarena.common.consortium.ConsortiumResult;
import com.tradingarena.common.exception.DataUnavailableException;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.SymbolSet;
import com.tradingarena.common.trace.TraceContextUtil;
import com.tradingarena.orchestrator.ai.AgentDecisionUnit;
import com.tradingarena.orchestrator.ai.DecisionOutcome;
import com.tradingarena.orchestrator.ai.SkipReason;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.ExecutionManager;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.logger.DecisionFlowLogger;
import com.tradingarena.orchestrator.marketdata.MarketContextProvider;
import com.tradingarena.orchestrator.risk.LossCircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one trading cycle: context, concurrent agent decisions and executions, then the
 * consortium vote and its execution.
 *
 * <p>At most one cycle runs at a time; a trigger that arrives while a cycle is running
 * is reported as {@code IN_PROGRESS} and dropped. Cycles only run once the books have been
 * loaded ({@link #markReady()}), while trading is enabled and the service is not shutting
 * down. Each agent's pipeline is isolated: a skip, timeout or error for one agent never
 * fails the cycle. An agent whose loss breaker is open is skipped before any inference.
 */
@Service
public class TradingCycleService {

    private static final Logger log = LoggerFactory.getLogger(TradingCycleService.class);

    private final MarketContextProvider contextProvider;
    private final AgentDecisionUnit decisionUnit;
    private final ExecutionManager executionManager;
    private final ConsortiumAggregator consortiumAggregator;
    private final LedgerRegistry registry;
    private final LossCircuitBreaker circuitBreaker;
    private final DecisionFlowLogger flowLogger;
    private final SymbolSet universe;
    private final ArenaProperties.Consortium consortiumSettings;
    private final Duration agentDecisionTimeout;
    private final Clock clock;

    private final AtomicBoolean tradingEnabled;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    /** Most recent decision of each independent agent; the consortium filters by cycle id. */
    private final Map<String, Decision> latestDecisions = new ConcurrentHashMap<>();

    public TradingCycleService(MarketContextProvider contextProvider, AgentDecisionUnit decisionUnit,
                               ExecutionManager executionManager, ConsortiumAggregator consortiumAggregator,
                               LedgerRegistry registry, LossCircuitBreaker circuitBreaker,
                               DecisionFlowLogger flowLogger, ArenaProperties properties, Clock clock) {
        this.contextProvider      = contextProvider;
        this.decisionUnit         = decisionUnit;
        this.executionManager     = executionManager;
        this.consortiumAggregator = consortiumAggregator;
        this.registry             = registry;
        this.circuitBreaker       = circuitBreaker;
        this.flowLogger           = flowLogger;
        this.universe             = properties.universeSet();
        this.consortiumSettings   = properties.consortium();
        this.agentDecisionTimeout = properties.timeouts().agentDecision();
        this.clock                = clock;
        this.tradingEnabled       = new AtomicBoolean(properties.tradingEnabled());
    }

    public Mono<CycleReport> runCycle(String trigger) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            if (shuttingDown.get()) {
                return Mono.just(CycleReport.notRun(trigger, CycleReport.Status.SHUTTING_DOWN, now));
            }
            if (!ready.get()) {
                log.warn("Cycle not started, books not loaded yet. trigger={}", trigger);
                return Mono.just(CycleReport.notRun(trigger, CycleReport.Status.NOT_READY, now));
            }
            if (!tradingEnabled.get()) {
                log.debug("Cycle not started, trading disabled. trigger={}", trigger);
                return Mono.just(CycleReport.notRun(trigger, CycleReport.Status.DISABLED, now));
            }
            if (!running.compareAndSet(false, true)) {
                log.warn("Cycle not started, previous cycle still running. trigger={}", trigger);
                return Mono.just(CycleReport.notRun(trigger, CycleReport.Status.IN_PROGRESS, now));
            }

            String cycleId = UUID.randomUUID().toString();
            log.info("Cycle started. cycleId={} trigger={} symbols={}", cycleId, trigger, universe.key());

            Mono<CycleReport> pipeline = Mono.just(cycleId)
                .doOnEach(flowLogger.stage(DecisionFlowLogger.CYCLE_STARTED))
                .flatMap(id -> contextProvider.getContext(universe))
                .doOnEach(flowLogger.stage(DecisionFlowLogger.CONTEXT_READY))
                .flatMap(context -> runAgents(cycleId, trigger, now, context))
                .onErrorResume(DataUnavailableException.class, e -> Mono.just(dataUnavailable(cycleId, trigger, now, e)))
                .doOnNext(report -> {
                    lastReport.set(report);
                    flowLogger.logWithTraceId(DecisionFlowLogger.CYCLE_COMPLETED, cycleId);
                    log.info("Cycle finished. cycleId={} status={} durationMs={}", cycleId, report.status(),
                             Duration.between(report.startedAt(), report.finishedAt()).toMillis());
                })
                .doFinally(signal -> running.set(false));

            return TraceContextUtil.withTraceId(pipeline, cycleId);
        });
    }

    private Mono<CycleReport> runAgents(String cycleId, String trigger, Instant startedAt, MarketContext context) {
        List<AgentProfile> independents = registry.profiles().stream()
            .filter(p -> !p.consortium())
            .toList();

        return Flux.fromIterable(independents)
            .flatMap(agent -> decideAndExecute(agent, context, cycleId))
            .collectSortedList(Comparator.comparing(AgentCycleResult::agentName))
            .doOnEach(flowLogger.stage(DecisionFlowLogger.AGENTS_DECIDED))
            .flatMap(results -> runConsortium(cycleId, context)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .map(consortium -> new CycleReport(cycleId, trigger, CycleReport.Status.COMPLETED, startedAt,
                                                   clock.instant(), results, consortium.orElse(null),
                                                   summarize(results))));
    }

    private Mono<AgentCycleResult> decideAndExecute(AgentProfile agent, MarketContext context, String cycleId) {
        Optional<String> open = circuitBreaker.check(agent.name());
        if (open.isPresent()) {
            return Mono.just(AgentCycleResult.of(
                new DecisionOutcome.Skipped(agent.name(), SkipReason.CIRCUIT_OPEN, open.get()), null));
        }
        return decisionUnit.decide(agent, context, cycleId)
            .timeout(agentDecisionTimeout)
            .onErrorResume(e -> {
                SkipReason reason = e instanceof TimeoutException ? SkipReason.TIMEOUT : SkipReason.INFERENCE_FAILED;
                log.warn("Agent pipeline failed. agent={} cycleId={} reason={} error={}",
                         agent.name(), cycleId, reason, e.toString());
                return Mono.just(new DecisionOutcome.Skipped(agent.name(), reason, String.valueOf(e.getMessage())));
            })
            .flatMap(outcome -> {
                if (!(outcome instanceof DecisionOutcome.Decided decided)) {
                    return Mono.just(AgentCycleResult.of(outcome, null));
                }
                latestDecisions.put(agent.name(), decided.decision());
                return executionManager.apply(agent, decided.decision(), context)
                    .map(result -> AgentCycleResult.of(outcome, result))
                    .onErrorResume(e -> {
                        log.error("Execution error. agent={} decisionId={} error={}",
                                  agent.name(), decided.decision().decisionId(), e.toString());
                        return Mono.just(AgentCycleResult.of(outcome, null));
                    });
            });
    }

    private Mono<AgentCycleResult> runConsortium(String cycleId, MarketContext context) {
        if (!consortiumSettings.enabled() || !registry.isRegistered(consortiumSettings.name())) {
            return Mono.empty();
        }
        AgentProfile consortium = registry.profile(consortiumSettings.name());
        Optional<String> open = circuitBreaker.check(consortium.name());
        if (open.isPresent()) {
            return Mono.just(AgentCycleResult.of(
                new DecisionOutcome.Skipped(consortium.name(), SkipReason.CIRCUIT_OPEN, open.get()), null));
        }
        Map<String, Double> winRates = AgentWinRateCalculator.compute(
            registry.ledgers(), consortiumSettings.minResolvedTrades(), consortiumSettings.defaultWinRate());

        ConsortiumResult result = consortiumAggregator.aggregate(cycleId, new ArrayList<>(latestDecisions.values()),
                                                                 winRates);
        Decision decision = result.decision();
        flowLogger.logConsortium(cycleId, decision.action().name(), decision.symbol(), decision.confidence(),
                                 result.voters().size(), result.staleIgnored());

        DecisionOutcome outcome = new DecisionOutcome.Decided(decision);
        return executionManager.apply(consortium, decision, context)
            .map(execution -> AgentCycleResult.of(outcome, execution))
            .onErrorResume(e -> {
                log.error("Consortium execution error. cycleId={} error={}", cycleId, e.toString());
                return Mono.just(AgentCycleResult.of(outcome, null));
            });
    }

    private CycleReport dataUnavailable(String cycleId, String trigger, Instant startedAt, DataUnavailableException e) {
        log.warn("Cycle skipped, no market context. cycleId={} reason={}", cycleId, e.getMessage());
        List<AgentCycleResult> skipped = registry.profiles().stream()
            .filter(p -> !p.consortium())
            .map(p -> AgentCycleResult.of(
                new DecisionOutcome.Skipped(p.name(), SkipReason.DATA_UNAVAILABLE, e.getMessage()), null))
            .toList();
        return new CycleReport(cycleId, trigger, CycleReport.Status.DATA_UNAVAILABLE, startedAt, clock.instant(),
                               skipped, null, e.getMessage());
    }

    private static String summarize(List<AgentCycleResult> results) {
        long decided = results.stream().filter(AgentCycleResult::decided).count();
        return decided + "/" + results.size() + " agents decided";
    }

    /** Called once the persisted books and today's spend are loaded. */
    public void markReady() {
        if (ready.compareAndSet(false, true)) {
            log.info("ARENA_READY");
        }
    }

    public boolean isReady() {
        return ready.get();
    }

    public void enable() {
        if (tradingEnabled.compareAndSet(false, true)) {
            log.info("TRADING_ENABLED");
        }
    }

    public void disable() {
        if (tradingEnabled.compareAndSet(true, false)) {
            log.info("TRADING_DISABLED");
        }
    }

    public boolean isEnabled() {
        return tradingEnabled.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Stops new cycles from starting; a running cycle finishes or times out on its own. */
    public void shutdown() {
        shuttingDown.set(true);
        log.info("Cycle service shutting down. cycleRunning={}", running.get());
    }

    public Optional<CycleReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }
}
