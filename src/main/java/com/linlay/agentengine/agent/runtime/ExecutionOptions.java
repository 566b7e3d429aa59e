package com.linlay.agentengine.agent.runtime;

import com.linlay.agentengine.model.ModelSettings;

/**
 * Per-call overrides. Null fields fall back to the agent (model, settings) or to
 * {@code agent.execution.max-turns}.
 */
public record ExecutionOptions(
        String modelOverride,
        Integer maxTurns,
        String streamSessionId,
        ModelSettings settings
) {

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(null, null, null, null);
    }

    public static ExecutionOptions withModel(String modelOverride) {
        return new ExecutionOptions(modelOverride, null, null, null);
    }

    public ExecutionOptions withMaxTurns(Integer maxTurns) {
        return new ExecutionOptions(modelOverride, maxTurns, streamSessionId, settings);
    }

    public ExecutionOptions withStreamSessionId(String streamSessionId) {
        return new ExecutionOptions(modelOverride, maxTurns, streamSessionId, settings);
    }

    public ExecutionOptions withSettings(ModelSettings settings) {
        return new ExecutionOptions(modelOverride, maxTurns, streamSessionId, settings);
    }
}
