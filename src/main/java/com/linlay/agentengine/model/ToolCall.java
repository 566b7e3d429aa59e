package com.linlay.agentengine.model;

import java.util.Map;

/**
 * A fully resolved tool call requested by the model.
 */
public record ToolCall(
        String id,
        String name,
        Map<String, Object> parameters
) {

    public ToolCall {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        parameters = parameters == null ? Map.of() : parameters;
    }
}
