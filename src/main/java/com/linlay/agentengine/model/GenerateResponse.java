package com.linlay.agentengine.model;

import java.util.List;
import java.util.Map;

/**
 * Complete model response. {@code metadata} is an opaque provider bag (model name, ids, timings)
 * that the loop never inspects.
 */
public record GenerateResponse(
        String content,
        List<ToolCall> toolCalls,
        TokenUsage usage,
        String finishReason,
        Map<String, Object> metadata
) {

    public GenerateResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? TokenUsage.ZERO : usage;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static GenerateResponse text(String content, TokenUsage usage) {
        return new GenerateResponse(content, List.of(), usage, "stop", Map.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
