package com.linlay.agentengine.trace;

import com.linlay.agentengine.model.TokenUsage;

import java.time.Instant;
import java.util.List;

public record Turn(
        String id,
        String runId,
        int turnNumber,
        TurnState state,
        String userMessage,
        String assistantMessage,
        TokenUsage usage,
        Instant startedAt,
        Long durationMs,
        Instant timestamp,
        List<ToolExecution> toolExecutions
) {

    public Turn {
        if (turnNumber < 1) {
            throw new IllegalArgumentException("turnNumber must be positive");
        }
        state = state == null ? TurnState.FINALIZED : state;
        userMessage = userMessage == null ? "" : userMessage;
        assistantMessage = assistantMessage == null ? "" : assistantMessage;
        usage = usage == null ? TokenUsage.ZERO : usage;
        timestamp = timestamp == null ? Instant.now() : timestamp;
        toolExecutions = toolExecutions == null ? List.of() : List.copyOf(toolExecutions);
    }

    /**
     * Unsaved finalized turn as built by the execution loop.
     */
    public static Turn draft(int turnNumber, String userMessage, String assistantMessage,
                             List<ToolExecution> toolExecutions, TokenUsage usage,
                             Instant startedAt, long durationMs) {
        return new Turn(null, null, turnNumber, TurnState.FINALIZED, userMessage, assistantMessage,
                usage, startedAt, durationMs, Instant.now(), toolExecutions);
    }

    public boolean isProvisional() {
        return state == TurnState.PROVISIONAL;
    }
}
