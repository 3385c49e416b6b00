package com.tradingarena.orchestrator.persistence;

import com.tradingarena.common.budget.BudgetState;
import com.tradingarena.common.model.AgentLedger;
import com.tradingarena.common.model.Decision;
import com.tradingarena.common.model.PortfolioSnapshot;
import com.tradingarena.common.model.Position;
import com.tradingarena.common.model.TradeAction;
import com.tradingarena.common.model.TradeRecord;
import com.tradingarena.common.model.TradeStatus;
import com.tradingarena.orchestrator.persistence.entity.AgentEntity;
import com.tradingarena.orchestrator.persistence.entity.BudgetUsageEntity;
import com.tradingarena.orchestrator.persistence.entity.DecisionLogEntity;
import com.tradingarena.orchestrator.persistence.entity.PortfolioSnapshotEntity;
import com.tradingarena.orchestrator.persistence.entity.PositionEntity;
import com.tradingarena.orchestrator.persistence.entity.TradeRecordEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Converts between domain records and R2DBC entities. Timestamps are stored as UTC
 * {@link LocalDateTime}.
 */
final class ArenaEntityMapper {

    private ArenaEntityMapper() {}

    static AgentLedger toLedger(AgentEntity e) {
        return new AgentLedger(e.getAgentName(), e.getInitialCapital(), e.getCash(),
                               orZero(e.getRealizedProfit()), orZero(e.getTotalFees()),
                               orZero(e.getTradeCount()), orZero(e.getWinningCount()),
                               orZero(e.getLosingCount()), orZero(e.getPendingCount()));
    }

    static Position toPosition(PositionEntity e) {
        return new Position(e.getAgentName(), e.getSymbol(), e.getQuantity(), e.getCostBasis(),
                            e.getLastPrice(), orZero(e.getRealizedSinceOpen()));
    }

    static TradeRecord toTradeRecord(TradeRecordEntity e) {
        return new TradeRecord(e.getDecisionId(), e.getAgentName(), e.getCycleId(),
                               TradeAction.valueOf(e.getAction()), e.getSymbol(), e.getQuantity(),
                               e.getPrice(), e.getFillPrice(), e.getFee(), e.getRealizedPnl(), e.getClosingPnl(),
                               TradeStatus.valueOf(e.getStatus()), e.getBrokerOrderId(), e.getDetail(),
                               toInstant(e.getExecutedAt()));
    }

    static TradeRecordEntity toEntity(TradeRecord r) {
        TradeRecordEntity e = new TradeRecordEntity();
        e.setDecisionId(r.decisionId());
        e.setAgentName(r.agentName());
        e.setCycleId(r.cycleId());
        e.setAction(r.action().name());
        e.setSymbol(r.symbol());
        e.setQuantity(r.quantity());
        e.setPrice(r.price());
        e.setFillPrice(r.fillPrice());
        e.setFee(r.fee());
        e.setRealizedPnl(r.realizedPnl());
        e.setClosingPnl(r.closingPnl());
        e.setStatus(r.status().name());
        e.setBrokerOrderId(r.brokerOrderId());
        e.setDetail(r.detail());
        e.setExecutedAt(toUtc(r.executedAt()));
        return e;
    }

    static DecisionLogEntity toEntity(Decision d) {
        DecisionLogEntity e = new DecisionLogEntity();
        e.setDecisionId(d.decisionId());
        e.setAgentName(d.agentName());
        e.setCycleId(d.cycleId());
        e.setAction(d.action().name());
        e.setSymbol(d.symbol());
        e.setQuantity(d.quantity());
        e.setReasoning(d.reasoning());
        e.setConfidence(d.confidence());
        e.setSource(d.source().name());
        e.setParseFailure(d.parseFailure());
        e.setDecidedAt(toUtc(d.timestamp()));
        return e;
    }

    static PortfolioSnapshotEntity toEntity(PortfolioSnapshot s) {
        PortfolioSnapshotEntity e = new PortfolioSnapshotEntity();
        e.setAgentName(s.agentName());
        e.setCash(s.cash());
        e.setPositionsValue(s.positionsValue());
        e.setTotalValue(s.totalValue());
        e.setRealizedProfit(s.realizedProfit());
        e.setUnrealizedProfit(s.unrealizedProfit());
        e.setTotalFees(s.totalFees());
        e.setOpenPositions(s.openPositions());
        e.setTakenAt(toUtc(s.takenAt()));
        return e;
    }

    static BudgetState toBudgetState(BudgetUsageEntity e) {
        return new BudgetState(e.getUsageDay(), e.getTokensUsed() == null ? 0L : e.getTokensUsed(),
                               orZero(e.getCostUsed()), e.getCeiling());
    }

    static LocalDateTime toUtc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant toInstant(LocalDateTime utc) {
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
