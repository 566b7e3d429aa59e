package com.linlay.agentengine.trace.pricing;

import java.time.Instant;

/**
 * Price of a model in currency units per 1000 tokens.
 */
public record ModelPricing(
        String modelId,
        String provider,
        double inputPricePer1k,
        double outputPricePer1k,
        Instant lastUpdated
) {
}
