package com.tradingarena.orchestrator.service;

import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Position;
import com.tradingarena.orchestrator.budget.InferenceBudgetGovernor;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Brings the in-memory state up from the store: registers configured agents, loads their
 * persisted ledgers and positions, creates rows for new agents, and restores today's
 * inference spend.
 *
 * <p>Reads are retried with backoff. If the store stays unreachable the returned Mono fails;
 * cycles, reviews and budget flushes stay paused until a later attempt succeeds.
 */
@Service
public class ArenaBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(ArenaBootstrapService.class);

    private final ArenaProperties properties;
    private final LedgerRegistry registry;
    private final ArenaStore store;
    private final InferenceBudgetGovernor governor;
    private final ArenaProperties.Store storeSettings;

    public ArenaBootstrapService(ArenaProperties properties, LedgerRegistry registry, ArenaStore store,
                                 InferenceBudgetGovernor governor) {
        this.properties = properties;
        this.registry   = registry;
        this.store      = store;
        this.governor   = governor;
        this.storeSettings = properties.store();
    }

    public Mono<Void> bootstrap() {
        List<AgentProfile> profiles = properties.profiles();
        profiles.forEach(registry::register);

        Mono<Map<String, List<Position>>> positionsByAgent = store.loadPositions()
            .collect(Collectors.groupingBy(Position::agentName));

        Mono<Void> books = Mono.zip(store.loadLedgers().collectMap(AgentLedger::agentName), positionsByAgent)
            .flatMapMany(loaded -> Flux.fromIterable(profiles).concatMap(profile -> {
                AgentLedger persisted = loaded.getT1().get(profile.name());
                if (persisted != null) {
                    registry.load(persisted, loaded.getT2().getOrDefault(profile.name(), List.of()));
                    return Mono.empty();
                }
                log.info("AGENT_CREATED agent={} initialCapital={}", profile.name(),
                         profile.initialCapital().toPlainString());
                return store.saveLedger(registry.ledger(profile.name()));
            }))
            .then();

        Mono<Void> budget = store.loadBudget(governor.current().day())
            .doOnNext(governor::restore)
            .then();

        return books.then(budget)
            .retryWhen(Retry.backoff(storeSettings.maxRetries(), storeSettings.initialBackoff())
                .doBeforeRetry(signal -> log.warn("Arena bootstrap read failed, retrying. attempt={} reason={}",
                                                  signal.totalRetries() + 1, signal.failure().getMessage())))
            .doOnSuccess(v -> log.info("Arena bootstrapped. agents={} budget={}", profiles.size(), governor.snapshot()))
            .doOnError(e -> log.error("Arena bootstrap from store failed, trading stays paused. reason={}",
                                      e.getMessage()));
    }
}
