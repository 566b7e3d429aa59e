package com.linlay.agentengine.trace.pricing;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.catalog.ProviderCatalogClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Live per-token prices from the OpenRouter {@code /models} document, converted per 1k tokens.
 */
@Component
@Order(2)
public class OpenRouterPricingSource implements ModelPricingSource {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterPricingSource.class);
    static final String PROVIDER = "openrouter";

    private final AgentProviderProperties providerProperties;
    private final ProviderCatalogClient catalogClient;

    public OpenRouterPricingSource(AgentProviderProperties providerProperties, ProviderCatalogClient catalogClient) {
        this.providerProperties = providerProperties;
        this.catalogClient = catalogClient;
    }

    @Override
    public Optional<ModelPricing> fetch(String modelId, String provider) {
        if (!PROVIDER.equals(provider)) {
            return Optional.empty();
        }
        AgentProviderProperties.ProviderConfig config = providerProperties.getProvider(PROVIDER);
        if (config == null || config.getBaseUrl() == null) {
            return Optional.empty();
        }
        try {
            JsonNode root = catalogClient.fetchModelsDocument(config);
            if (root == null) {
                return Optional.empty();
            }
            for (JsonNode model : root.path("data")) {
                if (!modelId.equals(model.path("id").asText())) {
                    continue;
                }
                JsonNode pricing = model.path("pricing");
                if (!pricing.hasNonNull("prompt") || !pricing.hasNonNull("completion")) {
                    return Optional.empty();
                }
                return Optional.of(new ModelPricing(
                        modelId,
                        provider,
                        Double.parseDouble(pricing.get("prompt").asText()) * 1000d,
                        Double.parseDouble(pricing.get("completion").asText()) * 1000d,
                        Instant.now()
                ));
            }
        } catch (Exception ex) {
            log.warn("Cannot fetch OpenRouter pricing for {}: {}", modelId, ex.getMessage());
        }
        return Optional.empty();
    }
}
