package com.tradingarena.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.orchestrator.ai.DecisionOutcome;
import com.tradingarena.orchestrator.execution.ExecutionResult;

/**
 * One agent's part in a cycle, flattened for the cycle report.
 *
 * @param skipReason      set when the agent produced no decision
 * @param executionOutcome set when a decision reached the execution stage
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentCycleResult(
    String agentName,
    String decisionId,
    TradeAction action,
    String symbol,
    String quantity,
    Integer confidence,
    String skipReason,
    ExecutionResult.Outcome executionOutcome,
    String detail
) {

    public static AgentCycleResult of(DecisionOutcome outcome, ExecutionResult execution) {
        if (outcome instanceof DecisionOutcome.Skipped skipped) {
            return new AgentCycleResult(skipped.agentName(), null, null, null, null, null,
                                        skipped.reason().name(), null, skipped.detail());
        }
        var decision = ((DecisionOutcome.Decided) outcome).decision();
        return new AgentCycleResult(decision.agentName(), decision.decisionId(), decision.action(),
                                    decision.symbol(), decision.quantity().toPlainString(), decision.confidence(),
                                    null, execution == null ? null : execution.outcome(),
                                    execution == null ? "execution unavailable" : execution.detail());
    }

    public boolean decided() {
        return skipReason == null;
    }
}
