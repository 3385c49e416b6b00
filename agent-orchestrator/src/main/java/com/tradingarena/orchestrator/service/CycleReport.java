package com.tradingarena.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one cycle. A cycle that did not run carries only its status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleReport(
    String cycleId,
    String trigger,
    Status status,
    Instant startedAt,
    Instant finishedAt,
    List<AgentCycleResult> agents,
    AgentCycleResult consortium,
    String detail
) {

    public enum Status { COMPLETED, DATA_UNAVAILABLE, DISABLED, NOT_READY, IN_PROGRESS, SHUTTING_DOWN }

    public static CycleReport notRun(String trigger, Status status, Instant at) {
        return new CycleReport(null, trigger, status, at, at, List.of(), null, null);
    }
}
