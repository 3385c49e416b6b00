package com.tradingarena.orchestrator.controller.dto;

import com.tradingarena.common.budget.BudgetSnapshot;
import com.tradingarena.common.session.MarketSession;
import com.tradingarena.orchestrator.service.CycleReport;

public record ArenaStatus(
    boolean tradingEnabled,
    boolean ready,
    boolean cycleRunning,
    MarketSession session,
    BudgetSnapshot budget,
    int pendingWrites,
    CycleReport lastCycle
) {}
