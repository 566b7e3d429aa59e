package com.linlay.agentengine.stream.model;

import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;

import java.util.Objects;

/**
 * Normalized streaming event produced by a model adapter.
 */
public record StreamChunk(
        Type type,
        String text,
        ToolCall toolCall,
        TokenUsage usage,
        String error
) {

    public enum Type {
        CONTENT,
        TOOL_CALL,
        DONE,
        ERROR
    }

    public StreamChunk {
        Objects.requireNonNull(type, "type cannot be null");
    }

    public static StreamChunk content(String text) {
        return new StreamChunk(Type.CONTENT, text, null, null, null);
    }

    public static StreamChunk toolCall(ToolCall toolCall) {
        return new StreamChunk(Type.TOOL_CALL, null, Objects.requireNonNull(toolCall), null, null);
    }

    public static StreamChunk done(TokenUsage usage) {
        return new StreamChunk(Type.DONE, null, null, usage == null ? TokenUsage.ZERO : usage, null);
    }

    public static StreamChunk error(String message) {
        return new StreamChunk(Type.ERROR, null, null, null, message);
    }
}
