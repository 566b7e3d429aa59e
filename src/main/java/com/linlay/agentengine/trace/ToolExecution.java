package com.linlay.agentengine.trace;

import com.linlay.agentengine.tool.ToolResult;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One dispatched tool call. {@code id}, {@code runId} and {@code turnId} are null on drafts and
 * assigned by the trace store.
 */
public record ToolExecution(
        String id,
        String runId,
        String turnId,
        int turnNumber,
        String toolName,
        Map<String, Object> parameters,
        ToolResult result,
        Instant timestamp
) {

    public ToolExecution {
        Objects.requireNonNull(toolName, "toolName cannot be null");
        Objects.requireNonNull(result, "result cannot be null");
        parameters = parameters == null ? Map.of() : parameters;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ToolExecution draft(String id, int turnNumber, String toolName,
                                      Map<String, Object> parameters, ToolResult result) {
        return new ToolExecution(id, null, null, turnNumber, toolName, parameters, result, Instant.now());
    }

    public boolean success() {
        return result.success();
    }
}
