package com.linlay.agentengine.stream.model;

import java.util.List;
import java.util.Map;

/**
 * One parsed frame of an OpenAI-compatible stream, before tool-call fragments are merged.
 */
public record LlmDelta(
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason,
        Map<String, Object> usage
) {
}
