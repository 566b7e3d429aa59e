package com.linlay.agentengine.model;

import java.util.List;

/**
 * Generation settings. Null fields mean "provider default".
 */
public record ModelSettings(
        Double temperature,
        Integer maxTokens,
        Double topP,
        List<String> stopSequences
) {

    public ModelSettings {
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
    }

    public static ModelSettings defaults() {
        return new ModelSettings(null, null, null, List.of());
    }

    public static ModelSettings of(double temperature, int maxTokens) {
        return new ModelSettings(temperature, maxTokens, null, List.of());
    }

    /**
     * Non-null fields of {@code overrides} win over this instance.
     */
    public ModelSettings merge(ModelSettings overrides) {
        if (overrides == null) {
            return this;
        }
        return new ModelSettings(
                overrides.temperature != null ? overrides.temperature : temperature,
                overrides.maxTokens != null ? overrides.maxTokens : maxTokens,
                overrides.topP != null ? overrides.topP : topP,
                overrides.stopSequences.isEmpty() ? stopSequences : overrides.stopSequences
        );
    }
}
