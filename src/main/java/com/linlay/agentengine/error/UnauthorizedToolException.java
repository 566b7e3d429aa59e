package com.linlay.agentengine.error;

/**
 * Raised when a model asks for a tool outside the agent's allowlist. Always fatal to the run.
 */
public class UnauthorizedToolException extends AgentEngineException {

    private final String toolName;
    private final String agentId;

    public UnauthorizedToolException(String toolName, String agentId) {
        super("UNAUTHORIZED_TOOL", "Tool '%s' is not allowed for agent %s".formatted(toolName, agentId));
        this.toolName = toolName;
        this.agentId = agentId;
    }

    public String toolName() {
        return toolName;
    }

    public String agentId() {
        return agentId;
    }
}
