package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.config.ProviderProtocol;
import com.linlay.agentengine.error.ModelException;
import com.linlay.agentengine.model.ModelAdapter;
import com.linlay.agentengine.model.ModelRef;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Builds the adapter for a {@code provider:model} id from the configured provider protocol.
 */
@Component
public class ModelAdapterFactory {

    private final AgentProviderProperties providerProperties;
    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    public ModelAdapterFactory(
            AgentProviderProperties providerProperties,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        this.providerProperties = providerProperties;
        this.webClientBuilder = webClientBuilder;
        this.objectMapper = objectMapper;
    }

    public ModelAdapter create(String modelId) {
        ModelRef ref = ModelRef.parse(modelId, providerProperties.getDefaultProvider());
        AgentProviderProperties.ProviderConfig config = providerProperties.getProvider(ref.provider());
        if (config == null) {
            throw new ModelException(ref.provider(), "Unknown provider for model " + modelId);
        }
        ProviderProtocol protocol = config.getProtocol() == null
                ? ProviderProtocol.OPENAI_COMPATIBLE
                : config.getProtocol();
        return switch (protocol) {
            case OPENAI_COMPATIBLE -> new OpenAiCompatibleModelAdapter(
                    ref.provider(), ref.model(), config, webClientBuilder, objectMapper);
            case OLLAMA -> new OllamaModelAdapter(
                    ref.provider(), ref.model(), config, webClientBuilder, objectMapper);
            case ANTHROPIC -> new AnthropicModelAdapter(
                    ref.provider(), ref.model(), config, webClientBuilder, objectMapper);
        };
    }
}
