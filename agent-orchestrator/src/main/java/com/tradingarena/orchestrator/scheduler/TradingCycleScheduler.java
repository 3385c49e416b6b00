package com.tradingarena.orchestrator.scheduler;

import com.tradingarena.common.session.MarketSessionClassifier;
import com.tradingarena.orchestrator.budget.InferenceBudgetGovernor;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.ExecutionManager;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import com.tradingarena.orchestrator.service.ArenaBootstrapService;
import com.tradingarena.orchestrator.service.PositionReviewService;
import com.tradingarena.orchestrator.service.TradingCycleService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives the arena after startup with three independent loops:
 * <ul>
 *   <li><b>cycle</b>: runs a trading cycle, then waits the session-dependent cadence</li>
 *   <li><b>review</b>: marks positions to market, only while the regular session is open</li>
 *   <li><b>maintenance</b>: flushes today's inference spend and drains parked writes; until
 *       the bootstrap has succeeded it retries the bootstrap instead</li>
 * </ul>
 *
 * <p>Cycles, reviews and budget flushes wait for a successful bootstrap, which marks the
 * cycle service ready.
 *
 * <p>Each loop is a fresh {@link Mono} per iteration whose terminal {@code subscribe}
 * schedules the next one. Errors are absorbed and the loop reschedules; it only stops
 * on shutdown.
 */
@Component
public class TradingCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(TradingCycleScheduler.class);

    private final TradingCycleService cycleService;
    private final PositionReviewService reviewService;
    private final ArenaBootstrapService bootstrapService;
    private final ExecutionManager executionManager;
    private final InferenceBudgetGovernor governor;
    private final ArenaStore store;
    private final ArenaProperties.Schedule schedule;
    private final CadenceStrategy cadence;
    private final Clock clock;

    private final Disposable.Swap cycleLoop       = Disposables.swap();
    private final Disposable.Swap reviewLoop      = Disposables.swap();
    private final Disposable.Swap maintenanceLoop = Disposables.swap();
    private volatile boolean stopped;

    public TradingCycleScheduler(TradingCycleService cycleService, PositionReviewService reviewService,
                                 ArenaBootstrapService bootstrapService, ExecutionManager executionManager,
                                 InferenceBudgetGovernor governor, ArenaStore store, ArenaProperties properties,
                                 Clock clock) {
        this.cycleService     = cycleService;
        this.reviewService    = reviewService;
        this.bootstrapService = bootstrapService;
        this.executionManager = executionManager;
        this.governor         = governor;
        this.store            = store;
        this.schedule         = properties.schedule();
        this.cadence          = CadenceStrategy.from(schedule);
        this.clock            = clock;
    }

    @PostConstruct
    public void start() {
        bootstrap()
            .onErrorResume(e -> Mono.empty()) // logged by the bootstrap service; maintenance retries it
            .doFinally(signal -> {
                if (!schedule.enabled()) {
                    log.info("Scheduling disabled; cycles run only on manual trigger.");
                    return;
                }
                log.info("Scheduler started. initialDelaySeconds={} openIntervalSeconds={} closedIntervalSeconds={}",
                         schedule.initialDelay().toSeconds(), schedule.openInterval().toSeconds(),
                         schedule.closedInterval().toSeconds());
                scheduleCycle(schedule.initialDelay());
                scheduleReview(schedule.reviewInterval());
                scheduleMaintenance(schedule.maintenanceInterval());
            })
            .subscribe();
    }

    private void scheduleCycle(Duration delay) {
        if (stopped) return;
        cycleLoop.update(Mono.delay(delay)
            .then(cycleService.runCycle("scheduled"))
            .subscribe(
                report -> {
                    Duration next = cadence.nextDelay(clock.instant());
                    log.info("CADENCE_SELECTED session={} lastStatus={} nextIntervalSeconds={}",
                             MarketSessionClassifier.classify(clock.instant()), report.status(), next.toSeconds());
                    scheduleCycle(next);
                },
                err -> {
                    log.error("Scheduled cycle failed, rescheduling", err);
                    scheduleCycle(cadence.nextDelay(clock.instant()));
                }
            ));
    }

    private void scheduleReview(Duration delay) {
        if (stopped) return;
        reviewLoop.update(Mono.delay(delay)
            .then(Mono.defer(() -> {
                Instant now = clock.instant();
                if (!cycleService.isReady() || !MarketSessionClassifier.isMarketOpen(now)
                        || !cycleService.isEnabled()) {
                    return Mono.empty();
                }
                return reviewService.review().then();
            }))
            .subscribe(
                v -> { },
                err -> {
                    log.error("Position review failed, rescheduling", err);
                    scheduleReview(schedule.reviewInterval());
                },
                () -> scheduleReview(schedule.reviewInterval())
            ));
    }

    private void scheduleMaintenance(Duration delay) {
        if (stopped) return;
        maintenanceLoop.update(Mono.delay(delay)
            .then(maintenance())
            .subscribe(
                v -> { },
                err -> {
                    log.error("Maintenance pass failed, rescheduling", err);
                    scheduleMaintenance(schedule.maintenanceInterval());
                },
                () -> scheduleMaintenance(schedule.maintenanceInterval())
            ));
    }

    Mono<Void> maintenance() {
        if (!cycleService.isReady()) {
            return bootstrap()
                .onErrorResume(e -> {
                    log.warn("Bootstrap retry failed, arena stays paused. reason={}", e.getMessage());
                    return Mono.empty();
                });
        }
        return flushAndDrain();
    }

    private Mono<Void> bootstrap() {
        return bootstrapService.bootstrap()
            .doOnSuccess(v -> cycleService.markReady());
    }

    private Mono<Void> flushAndDrain() {
        Mono<Void> flush = Mono.defer(() -> store.saveBudget(governor.current()))
            .onErrorResume(e -> {
                log.warn("Budget flush failed. reason={}", e.getMessage());
                return Mono.empty();
            });
        return flush
            .then(executionManager.drainPendingWrites())
            .doOnNext(drained -> {
                if (drained > 0) {
                    log.info("PENDING_WRITES_DRAINED count={}", drained);
                }
            })
            .then();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        cycleService.shutdown();
        if (cycleService.isRunning()) {
            log.info("Cycle in flight at shutdown; leaving it to complete or time out.");
        } else {
            cycleLoop.dispose();
        }
        reviewLoop.dispose();
        maintenanceLoop.dispose();
        Mono<Void> last = cycleService.isReady() ? flushAndDrain() : Mono.empty();
        last
            .timeout(Duration.ofSeconds(5))
            .onErrorResume(e -> {
                log.warn("Final maintenance pass incomplete. reason={}", e.getMessage());
                return Mono.empty();
            })
            .block();
        log.info("Scheduler stopped.");
    }
}
