package com.linlay.agentengine.agent;

import com.linlay.agentengine.model.ModelSettings;

import java.time.Instant;
import java.util.List;

/**
 * Agent configuration as read by the execution loop. {@code messageWindowSize} is null when
 * the conversation buffer is never compressed.
 */
public record Agent(
        String id,
        String name,
        String description,
        String systemPrompt,
        int promptVersion,
        String defaultModel,
        List<String> allowedTools,
        List<String> tags,
        ModelSettings settings,
        Integer messageWindowSize,
        boolean structuredMemoryEnabled,
        Instant createdAt,
        Instant updatedAt
) {

    public Agent {
        description = description == null ? "" : description;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        tags = tags == null ? List.of() : List.copyOf(tags);
        settings = settings == null ? ModelSettings.defaults() : settings;
    }

    public boolean hasMessageWindow() {
        return messageWindowSize != null && messageWindowSize > 0;
    }
}
