package com.linlay.agentengine.error;

public class ToolExecutionException extends AgentEngineException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super("TOOL_EXECUTION_ERROR", "Tool '%s' failed: %s".formatted(toolName, message), cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
