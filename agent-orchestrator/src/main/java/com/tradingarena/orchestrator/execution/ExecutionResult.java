package com.tradingarena.orchestrator.execution;

import com.tradingarena.common.model.TradeRecord;

/**
 * What happened to one decision at the execution stage.
 *
 * @param record    the trade record written, {@code null} for HELD and DUPLICATE
 * @param persisted {@code false} when a filled execution could not be written and was parked for retry
 */
public record ExecutionResult(String agentName, String decisionId, Outcome outcome, TradeRecord record,
                              String detail, boolean persisted) {

    public enum Outcome { HELD, FILLED, NOT_EXECUTED, FAILED, DUPLICATE }

    public static ExecutionResult held(String agentName, String decisionId) {
        return new ExecutionResult(agentName, decisionId, Outcome.HELD, null, "hold", true);
    }

    public static ExecutionResult duplicate(String agentName, String decisionId) {
        return new ExecutionResult(agentName, decisionId, Outcome.DUPLICATE, null, "already executed", true);
    }

    public boolean isFilled() {
        return outcome == Outcome.FILLED;
    }
}
