package com.linlay.agentengine.trace;

public record ToolStats(
        String toolName,
        long count,
        long successCount,
        double successRate,
        double avgExecutionTimeMs
) {
}
