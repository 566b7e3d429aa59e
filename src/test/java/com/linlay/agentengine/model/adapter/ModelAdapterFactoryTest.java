package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.config.ProviderProtocol;
import com.linlay.agentengine.error.ModelException;
import com.linlay.agentengine.model.ModelAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelAdapterFactoryTest {

    private final ModelAdapterFactory factory =
            new ModelAdapterFactory(providerProperties(), WebClient.builder(), new ObjectMapper());

    @Test
    void shouldPickAdapterByProviderProtocol() {
        assertThat(factory.create("openrouter:meta-llama/llama-3.1-8b-instruct"))
                .isInstanceOf(OpenAiCompatibleModelAdapter.class);
        assertThat(factory.create("anthropic:claude-3-5-haiku-latest")).isInstanceOf(AnthropicModelAdapter.class);

        ModelAdapter tagged = factory.create("ollama:llama3:8b");
        assertThat(tagged).isInstanceOf(OllamaModelAdapter.class);
        assertThat(tagged.model()).isEqualTo("llama3:8b");

        ModelAdapter bare = factory.create("llama3.1");
        assertThat(bare.provider()).isEqualTo("ollama");
        assertThat(bare.model()).isEqualTo("llama3.1");
    }

    @Test
    void shouldRejectUnknownProviderAndMissingBaseUrl() {
        assertThatThrownBy(() -> factory.create("mistral:large"))
                .isInstanceOf(ModelException.class)
                .hasMessageStartingWith("[mistral]");
        assertThatThrownBy(() -> factory.create("openai:gpt-4o-mini"))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("Missing base-url");
    }

    private static AgentProviderProperties providerProperties() {
        Map<String, AgentProviderProperties.ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("ollama", config(ProviderProtocol.OLLAMA, "http://localhost:11434"));
        providers.put("openrouter", config(ProviderProtocol.OPENAI_COMPATIBLE, "https://openrouter.ai/api/v1"));
        providers.put("anthropic", config(ProviderProtocol.ANTHROPIC, "https://api.anthropic.com"));
        providers.put("openai", config(ProviderProtocol.OPENAI_COMPATIBLE, null));
        AgentProviderProperties properties = new AgentProviderProperties();
        properties.setProviders(providers);
        properties.setDefaultProvider("ollama");
        return properties;
    }

    private static AgentProviderProperties.ProviderConfig config(ProviderProtocol protocol, String baseUrl) {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setProtocol(protocol);
        config.setBaseUrl(baseUrl);
        return config;
    }
}
