package com.linlay.agentengine.model;

import java.time.Instant;

/**
 * Catalog entry of a model. The id is {@code provider:model}.
 */
public record ModelInfo(
        String id,
        String provider,
        String name,
        Integer contextWindow,
        Double inputCostPerMillion,
        Double outputCostPerMillion,
        boolean supportsTools,
        boolean supportsStreaming,
        Instant lastUsed,
        Double tokensPerSecond
) {

    public static String composeId(String provider, String model) {
        return provider + ":" + model;
    }

    public String modelName() {
        int separator = id.indexOf(':');
        return separator < 0 ? id : id.substring(separator + 1);
    }

    public ModelInfo withUsage(Instant usedAt, Double measuredTokensPerSecond) {
        return new ModelInfo(
                id,
                provider,
                name,
                contextWindow,
                inputCostPerMillion,
                outputCostPerMillion,
                supportsTools,
                supportsStreaming,
                usedAt,
                measuredTokensPerSecond == null ? tokensPerSecond : measuredTokensPerSecond
        );
    }
}
