package com.linlay.agentengine.tool;

import java.util.Map;

public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    default ToolParameterSchema parametersSchema() {
        return ToolParameterSchema.empty();
    }

    /**
     * Runs the tool. Required parameters are already checked by the registry; implementations
     * may still return {@link ToolResult#failure(String)} or throw.
     */
    ToolResult execute(Map<String, Object> parameters);
}
