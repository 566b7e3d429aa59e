package com.linlay.agentengine.trace;

import com.linlay.agentengine.model.ModelSettings;

import java.util.List;
import java.util.Optional;

/**
 * Durable, incrementally written record of runs, turns and tool executions.
 */
public interface TraceStore {

    Run createRun(String agentId, String modelUsed, ModelSettings modelSettings, Integer promptVersion);

    /**
     * Appends the next finalized turn. A provisional turn with the same number is finalized in
     * place and keeps the executions already logged against it. Run counters are increased by
     * the turn's usage.
     */
    Turn appendTurn(String runId, Turn turn);

    /**
     * Persists one execution as soon as it completes. When no turn with the execution's turn
     * number exists yet, a provisional one is created to own it.
     */
    ToolExecution logToolExecution(String runId, ToolExecution execution);

    void updateRunStatus(String runId, RunStatus status, String error);

    /**
     * Moves a running run to a terminal status. Provisional turns still open are finalized, so a
     * later continuation never reuses their turn numbers.
     */
    void updateRunStatus(String runId, RunStatus status, String error, Long durationMs);

    /**
     * Moves a finished run back to {@code RUNNING} so that a continuation can append to it.
     */
    void reopenRun(String runId);

    void updateRunVersion(String runId, RunVersion version);

    Optional<Run> getRun(String runId);

    List<Run> queryRuns(RunQuery query);

    void deleteRun(String runId);

    List<ToolStats> getToolStats(String agentId);

    int countRunsWithMemory(String agentId);
}
