package com.tradingarena.orchestrator.controller;

import com.tradingarena.common.budget.BudgetSnapshot;
import com.tradingarena.common.exception.UnknownAgentException;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.common.session.MarketSessionClassifier;
import com.tradingarena.orchestrator.budget.InferenceBudgetGovernor;
import com.tradingarena.orchestrator.controller.dto.AgentStanding;
import com.tradingarena.orchestrator.controller.dto.ArenaStatus;
import com.tradingarena.orchestrator.controller.dto.CeilingUpdateRequest;
import com.tradingarena.orchestrator.execution.AgentBook;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.execution.PendingWriteQueue;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import com.tradingarena.orchestrator.service.CycleReport;
import com.tradingarena.orchestrator.service.TradingCycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Operator controls and read-only views of the arena.
 */
@RestController
@RequestMapping("/api/v1/arena")
public class ArenaController {

    private static final Logger log = LoggerFactory.getLogger(ArenaController.class);
    private static final int MAX_TRADE_LIMIT = 500;

    private final TradingCycleService cycleService;
    private final InferenceBudgetGovernor governor;
    private final LedgerRegistry registry;
    private final ArenaStore store;
    private final PendingWriteQueue pendingWrites;
    private final Clock clock;

    public ArenaController(TradingCycleService cycleService, InferenceBudgetGovernor governor,
                           LedgerRegistry registry, ArenaStore store, PendingWriteQueue pendingWrites,
                           Clock clock) {
        this.cycleService  = cycleService;
        this.governor      = governor;
        this.registry      = registry;
        this.store         = store;
        this.pendingWrites = pendingWrites;
        this.clock         = clock;
    }

    // ── trading switch ──────────────────────────────────────────────────────

    @PostMapping("/trading/start")
    public Mono<ResponseEntity<Map<String, Object>>> startTrading() {
        log.info("Trading start requested");
        cycleService.enable();
        return Mono.just(ResponseEntity.ok(Map.of("tradingEnabled", true)));
    }

    @PostMapping("/trading/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stopTrading() {
        log.info("Trading stop requested");
        cycleService.disable();
        return Mono.just(ResponseEntity.ok(Map.of("tradingEnabled", false)));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<ArenaStatus>> status() {
        return Mono.just(ResponseEntity.ok(new ArenaStatus(
            cycleService.isEnabled(),
            cycleService.isReady(),
            cycleService.isRunning(),
            MarketSessionClassifier.classify(clock.instant()),
            governor.snapshot(),
            pendingWrites.size(),
            cycleService.lastReport().orElse(null))));
    }

    // ── budget ──────────────────────────────────────────────────────────────

    @GetMapping("/budget")
    public Mono<ResponseEntity<BudgetSnapshot>> budget() {
        return Mono.just(ResponseEntity.ok(governor.snapshot()));
    }

    @PutMapping("/budget/ceiling")
    public Mono<ResponseEntity<BudgetSnapshot>> updateCeiling(@RequestBody CeilingUpdateRequest request) {
        log.info("Budget ceiling update requested. ceiling={}", request.ceiling());
        try {
            return Mono.just(ResponseEntity.ok(governor.updateCeiling(request.ceiling())));
        } catch (IllegalArgumentException e) {
            log.warn("Budget ceiling rejected. reason={}", e.getMessage());
            return Mono.just(ResponseEntity.badRequest().build());
        }
    }

    // ── cycles ──────────────────────────────────────────────────────────────

    /** The cycle runs on its own subscription; a client that disconnects does not cancel it. */
    @PostMapping("/cycles/trigger")
    public Mono<ResponseEntity<CycleReport>> triggerCycle() {
        log.info("Manual cycle trigger received");
        return Mono.fromFuture(() -> cycleService.runCycle("manual").toFuture(), true)
            .map(report -> switch (report.status()) {
                case DISABLED, NOT_READY, IN_PROGRESS, SHUTTING_DOWN -> ResponseEntity.status(HttpStatus.CONFLICT).body(report);
                default -> ResponseEntity.ok(report);
            })
            .doOnError(e -> log.error("Manual cycle failed", e));
    }

    @GetMapping("/cycles/last")
    public Mono<ResponseEntity<CycleReport>> lastCycle() {
        return Mono.justOrEmpty(cycleService.lastReport())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    // ── agents ──────────────────────────────────────────────────────────────

    /** Leaderboard, best portfolio value first. */
    @GetMapping("/agents")
    public Flux<AgentStanding> standings() {
        List<AgentStanding> rows = registry.profiles().stream()
            .map(this::standingOf)
            .sorted(Comparator.comparing(AgentStanding::portfolioValue).reversed()
                .thenComparing(AgentStanding::agentName))
            .toList();
        return Flux.fromIterable(rows);
    }

    @GetMapping("/agents/{name}")
    public Mono<ResponseEntity<AgentStanding>> agent(@PathVariable String name) {
        if (!registry.isRegistered(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(standingOf(registry.profile(name))));
    }

    @GetMapping("/agents/{name}/positions")
    public Mono<ResponseEntity<Collection<Position>>> positions(@PathVariable String name) {
        if (!registry.isRegistered(name)) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(registry.positions(name)));
    }

    @GetMapping("/agents/{name}/trades")
    public Flux<TradeRecord> trades(@PathVariable String name,
                                    @RequestParam(defaultValue = "20") int limit) {
        if (!registry.isRegistered(name)) {
            return Flux.error(new UnknownAgentException(name));
        }
        return store.recentTrades(name, Math.max(1, Math.min(limit, MAX_TRADE_LIMIT)));
    }

    @ExceptionHandler(UnknownAgentException.class)
    public ResponseEntity<Map<String, String>> unknownAgent(UnknownAgentException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    private AgentStanding standingOf(AgentProfile profile) {
        AgentBook book = registry.book(profile.name());
        return AgentStanding.of(profile, book.ledger(), registry.portfolioValue(profile.name()),
                                book.positions().size());
    }
}
