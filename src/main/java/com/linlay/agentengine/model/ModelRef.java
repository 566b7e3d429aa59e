package com.linlay.agentengine.model;

import com.linlay.agentengine.error.ValidationException;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * A model id split into provider key and provider-side model name. Only the first colon
 * separates them, so names like {@code llama3:8b} survive.
 */
public record ModelRef(String provider, String model) {

    public static ModelRef parse(String modelId, String defaultProvider) {
        if (!StringUtils.hasText(modelId)) {
            throw new ValidationException("Model id must not be blank");
        }
        String trimmed = modelId.trim();
        int separator = trimmed.indexOf(':');
        if (separator <= 0) {
            if (!StringUtils.hasText(defaultProvider)) {
                throw new ValidationException("Model id has no provider prefix: " + modelId);
            }
            return new ModelRef(defaultProvider.trim().toLowerCase(Locale.ROOT), trimmed);
        }
        String model = trimmed.substring(separator + 1);
        if (model.isBlank()) {
            throw new ValidationException("Model id has no model name: " + modelId);
        }
        return new ModelRef(trimmed.substring(0, separator).toLowerCase(Locale.ROOT), model);
    }

    public String id() {
        return ModelInfo.composeId(provider, model);
    }
}
