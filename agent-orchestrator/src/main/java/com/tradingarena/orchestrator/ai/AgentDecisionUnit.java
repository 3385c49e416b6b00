package com.tradingarena.orchestrator.ai;

import com.tradingarena.common.budget.BudgetReservation;
import com.tradingarena.common.budget.BudgetReservation.Denied;
import com.tradingarena.common.budget.BudgetReservation.Grant;
import com.tradingarena.common.critique.SelfCritiqueCalculator;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.SelfCritique;
import com.tradingarena.orchestrator.budget.CostEstimate;
import com.tradingarena.orchestrator.budget.InferenceBudgetGovernor;
import com.tradingarena.orchestrator.budget.InferencePricing;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.AgentBook;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import com.tradingarena.orchestrator.persistence.ArenaStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns a market context into one agent's decision through a single governed inference call.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Summarize the agent's own trade history into a self-critique (no inference spend).</li>
 *   <li>Build the bounded prompt and price it with the agent's model.</li>
 *   <li>Reserve budget. A denial skips the agent for this cycle.</li>
 *   <li>Call the provider with a timeout. Failure or timeout refunds the reservation and skips.</li>
 *   <li>Settle the reservation against reported usage, then parse the reply. An unusable reply
 *       becomes HOLD with confidence 0; it is not retried.</li>
 * </ol>
 *
 * <p>Stateless apart from its collaborators; one instance serves every agent.
 */
@Service
public class AgentDecisionUnit {

    private static final Logger log = LoggerFactory.getLogger(AgentDecisionUnit.class);

    private final InferenceBudgetGovernor governor;
    private final InferencePricing pricing;
    private final InferenceClient inference;
    private final DecisionResponseParser parser;
    private final LedgerRegistry registry;
    private final ArenaStore store;
    private final ArenaProperties.Decision settings;
    private final ArenaProperties.Timeouts timeouts;
    private final BigDecimal fee;
    private final Clock clock;

    public AgentDecisionUnit(InferenceBudgetGovernor governor, InferencePricing pricing, InferenceClient inference,
                             DecisionResponseParser parser, LedgerRegistry registry, ArenaStore store,
                             ArenaProperties properties, Clock clock) {
        this.governor  = governor;
        this.pricing   = pricing;
        this.inference = inference;
        this.parser    = parser;
        this.registry  = registry;
        this.store     = store;
        this.settings  = properties.decision();
        this.timeouts  = properties.timeouts();
        this.fee       = properties.execution().fee();
        this.clock     = clock;
    }

    public Mono<DecisionOutcome> decide(AgentProfile agent, MarketContext context, String cycleId) {
        if (agent.consortium()) {
            return Mono.error(new IllegalArgumentException("consortium agent " + agent.name()
                + " does not call the inference provider"));
        }
        return critique(agent).flatMap(critique -> {
            AgentBook book = registry.book(agent.name());
            Prompt prompt = PromptBuilder.build(agent, book.ledger(), book.positions().values(), context,
                                                critique.orElse(null), fee, settings.maxPromptChars());
            CostEstimate estimate = pricing.estimate(agent, prompt.combined(), settings.maxTokens());

            BudgetReservation reservation = governor.tryReserve(estimate.cost(), estimate.totalTokens());
            if (reservation instanceof Denied denied) {
                log.warn("DECISION_SKIPPED agent={} cycleId={} reason={} detail={}",
                         agent.name(), cycleId, SkipReason.BUDGET_EXCEEDED, denied.detail());
                return Mono.just(new DecisionOutcome.Skipped(agent.name(), SkipReason.BUDGET_EXCEEDED,
                                                             denied.detail()));
            }
            return infer(agent, cycleId, prompt, (Grant) reservation);
        });
    }

    private Mono<Optional<SelfCritique>> critique(AgentProfile agent) {
        return store.recentTrades(agent.name(), settings.historyLimit())
            .collectList()
            .map(history -> SelfCritiqueCalculator.summarize(history, settings.critiqueEvery(),
                                                             settings.critiqueWindow()))
            .doOnNext(c -> c.ifPresent(sc -> log.debug("SELF_CRITIQUE agent={} reviewed={} wins={} losses={}",
                                                       agent.name(), sc.tradesReviewed(), sc.wins(), sc.losses())))
            .onErrorResume(e -> {
                log.warn("Trade history unavailable, deciding without self-critique. agent={} reason={}",
                         agent.name(), e.toString());
                return Mono.just(Optional.empty());
            });
    }

    private Mono<DecisionOutcome> infer(AgentProfile agent, String cycleId, Prompt prompt, Grant grant) {
        InferenceRequest request = new InferenceRequest(agent.name(), agent.modelId(), prompt.system(), prompt.user(),
                                                        settings.maxTokens(), settings.temperature());
        // settled or refunded exactly once, whichever terminal signal arrives first
        AtomicBoolean closed = new AtomicBoolean();
        return inference.complete(request)
            .timeout(timeouts.inference())
            .<DecisionOutcome>map(response -> {
                if (closed.compareAndSet(false, true)) {
                    settle(agent, grant, response);
                }
                Decision decision = parser.parse(agent.name(), cycleId, response.text(), clock.instant());
                log.info("DECISION_PRODUCED agent={} cycleId={} action={} symbol={} quantity={} confidence={} parseFailure={}",
                         agent.name(), cycleId, decision.action(), decision.symbol(),
                         decision.quantity().toPlainString(), decision.confidence(), decision.parseFailure());
                return new DecisionOutcome.Decided(decision);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                refundOnce(grant, closed);
                return new DecisionOutcome.Skipped(agent.name(), SkipReason.INFERENCE_FAILED, "empty response");
            }))
            .onErrorResume(e -> {
                refundOnce(grant, closed);
                SkipReason reason = e instanceof TimeoutException ? SkipReason.TIMEOUT : SkipReason.INFERENCE_FAILED;
                log.warn("DECISION_SKIPPED agent={} cycleId={} reason={} detail={}",
                         agent.name(), cycleId, reason, e.getMessage());
                return Mono.just(new DecisionOutcome.Skipped(agent.name(), reason, String.valueOf(e.getMessage())));
            })
            .doOnCancel(() -> refundOnce(grant, closed));
    }

    private void refundOnce(Grant grant, AtomicBoolean closed) {
        if (closed.compareAndSet(false, true)) {
            governor.refund(grant);
        }
    }

    private void settle(AgentProfile agent, Grant grant, InferenceResponse response) {
        if (!response.hasUsage()) {
            return;
        }
        BigDecimal actual = pricing.actualCost(agent, response.promptTokens(), response.completionTokens());
        governor.settle(grant, actual, response.promptTokens() + response.completionTokens());
    }
}
