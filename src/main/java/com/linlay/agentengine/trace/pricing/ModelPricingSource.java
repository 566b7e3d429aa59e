package com.linlay.agentengine.trace.pricing;

import java.util.Optional;

/**
 * Where pricing comes from when it is not cached yet.
 */
public interface ModelPricingSource {

    Optional<ModelPricing> fetch(String modelId, String provider);
}
