package com.linlay.agentengine.model;

import java.util.List;
import java.util.Objects;

/**
 * Entry of the rolling conversation buffer handed to a model adapter. Not persisted as is;
 * rebuilt from the run trace on continuation.
 */
public record Message(
        MessageRole role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public Message {
        Objects.requireNonNull(role, "role cannot be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static Message system(String content) {
        return new Message(MessageRole.SYSTEM, content, List.of(), null);
    }

    public static Message user(String content) {
        return new Message(MessageRole.USER, content, List.of(), null);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return new Message(MessageRole.ASSISTANT, content, toolCalls, null);
    }

    public static Message tool(String toolCallId, String content) {
        return new Message(MessageRole.TOOL, content, List.of(), toolCallId);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
