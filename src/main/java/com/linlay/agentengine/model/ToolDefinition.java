package com.linlay.agentengine.model;

import java.util.Map;

/**
 * Function declaration sent to the model: name, description and JSON schema of the parameters.
 */
public record ToolDefinition(
        String name,
        String description,
        Map<String, Object> parameters
) {

    public ToolDefinition {
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of("type", "object", "properties", Map.of()) : parameters;
    }
}
