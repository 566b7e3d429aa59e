package com.linlay.agentengine.trace.pricing;

import com.linlay.agentengine.model.ModelInfo;
import com.linlay.agentengine.model.ModelRegistryService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Pricing known to the model registry (definition files and provider catalogs).
 */
@Component
@Order(1)
public class RegistryPricingSource implements ModelPricingSource {

    private final ModelRegistryService modelRegistry;

    public RegistryPricingSource(ModelRegistryService modelRegistry) {
        this.modelRegistry = modelRegistry;
    }

    @Override
    public Optional<ModelPricing> fetch(String modelId, String provider) {
        return modelRegistry.find(ModelInfo.composeId(provider, modelId))
                .filter(info -> info.inputCostPerMillion() != null && info.outputCostPerMillion() != null)
                .map(info -> new ModelPricing(
                        modelId,
                        provider,
                        info.inputCostPerMillion() / 1000d,
                        info.outputCostPerMillion() / 1000d,
                        Instant.now()
                ));
    }
}
