package com.linlay.agentengine.stream.adapter.ollama;

import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;

import java.util.List;

public record OllamaChunk(
        String content,
        List<ToolCall> toolCalls,
        boolean done,
        TokenUsage usage,
        String doneReason
) {

    public OllamaChunk {
        toolCalls = toolCalls == null ? List.of() : toolCalls;
    }
}
