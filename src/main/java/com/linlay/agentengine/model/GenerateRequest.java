package com.linlay.agentengine.model;

import java.util.List;

public record GenerateRequest(
        String systemPrompt,
        List<Message> messages,
        List<ToolDefinition> tools,
        ModelSettings settings
) {

    public GenerateRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        settings = settings == null ? ModelSettings.defaults() : settings;
    }
}
