package com.linlay.agentengine.trace;

import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;

import java.time.Instant;
import java.util.List;

public record Run(
        String id,
        String agentId,
        String modelUsed,
        RunStatus status,
        TokenUsage usage,
        int totalToolCalls,
        ModelSettings modelSettings,
        Instant createdAt,
        Instant completedAt,
        String error,
        Long totalDurationMs,
        RunVersion version,
        List<Turn> turns
) {

    public Run {
        usage = usage == null ? TokenUsage.ZERO : usage;
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public List<Turn> finalizedTurns() {
        return turns.stream().filter(turn -> !turn.isProvisional()).toList();
    }

    public int lastFinalizedTurnNumber() {
        return turns.stream()
                .filter(turn -> !turn.isProvisional())
                .mapToInt(Turn::turnNumber)
                .max()
                .orElse(0);
    }
}
