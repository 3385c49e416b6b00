package com.tradingarena.orchestrator.ai;

import com.tradingarena.common.model.Decision;

/**
 * Result of one agent's decision step: a {@link Decided} decision or a {@link Skipped}
 * cycle. A skip never carries a fabricated decision.
 */
public sealed interface DecisionOutcome permits DecisionOutcome.Decided, DecisionOutcome.Skipped {

    String agentName();

    record Decided(Decision decision) implements DecisionOutcome {
        @Override
        public String agentName() {
            return decision.agentName();
        }
    }

    record Skipped(String agentName, SkipReason reason, String detail) implements DecisionOutcome {}
}
