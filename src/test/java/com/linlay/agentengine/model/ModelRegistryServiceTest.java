package com.linlay.agentengine.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.config.ProviderProtocol;
import com.linlay.agentengine.model.catalog.ProviderCatalogClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelRegistryServiceTest {

    @TempDir
    Path tempDir;

    private final ProviderCatalogClient catalogClient = mock(ProviderCatalogClient.class);

    @Test
    void shouldLoadModelDefinitionWithPricing() throws Exception {
        Path modelsDir = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(modelsDir.resolve("gpt-4o-mini.json"), """
                {
                  // prices per million tokens
                  "provider": "openai",
                  "model": "gpt-4o-mini",
                  "name": "GPT-4o mini",
                  "contextWindow": 128000,
                  "inputCostPerMillion": 0.15,
                  "outputCostPerMillion": 0.6,
                  "supportsTools": true
                }
                """);

        ModelRegistryService service = service(modelsDir, false);

        ModelInfo model = service.find("openai:gpt-4o-mini").orElseThrow();
        assertThat(model.provider()).isEqualTo("openai");
        assertThat(model.name()).isEqualTo("GPT-4o mini");
        assertThat(model.modelName()).isEqualTo("gpt-4o-mini");
        assertThat(model.contextWindow()).isEqualTo(128000);
        assertThat(model.inputCostPerMillion()).isEqualTo(0.15);
        assertThat(model.outputCostPerMillion()).isEqualTo(0.6);
    }

    @Test
    void shouldSkipDefinitionsWithUnknownProviderOrMissingModel() throws Exception {
        Path modelsDir = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(modelsDir.resolve("a.json"), """
                {"provider": "missing", "model": "x"}
                """);
        Files.writeString(modelsDir.resolve("b.json"), """
                {"provider": "openai"}
                """);
        Files.writeString(modelsDir.resolve("c.json"), "{ not json");

        ModelRegistryService service = service(modelsDir, false);

        assertThat(service.list()).extracting(ModelInfo::id).containsExactly("ollama:llama3.1");
    }

    @Test
    void shouldIncludeConfiguredDefaultsAndResolveBareIdsAgainstDefaultProvider() {
        ModelRegistryService service = service(tempDir.resolve("absent"), false);

        assertThat(service.find("llama3.1")).get().extracting(ModelInfo::id).isEqualTo("ollama:llama3.1");
        assertThat(service.find("")).isEmpty();
    }

    @Test
    void laterSourcesShouldOverrideCatalogEntries() throws Exception {
        Path modelsDir = Files.createDirectories(tempDir.resolve("models"));
        Files.writeString(modelsDir.resolve("override.json"), """
                {"provider": "ollama", "model": "llama3.1", "contextWindow": 32768}
                """);
        when(catalogClient.fetch(anyString(), any())).thenReturn(List.of());
        when(catalogClient.fetch(eq("ollama"), any())).thenReturn(List.of(
                new ModelInfo("ollama:llama3.1", "ollama", "llama3.1", 8192, 0.0, 0.0, true, true, null, null),
                new ModelInfo("ollama:qwen2.5:7b", "ollama", "qwen2.5:7b", 8192, 0.0, 0.0, true, true, null, null)
        ));

        ModelRegistryService service = service(modelsDir, true);

        assertThat(service.find("ollama:llama3.1").orElseThrow().contextWindow()).isEqualTo(32768);
        assertThat(service.find("ollama:qwen2.5:7b")).isPresent();
    }

    @Test
    void lookupMissShouldRefreshOnce() {
        when(catalogClient.fetch(anyString(), any())).thenReturn(List.of());
        ModelRegistryService service = service(tempDir.resolve("absent"), true);

        assertThat(service.find("openai:unknown")).isEmpty();

        verify(catalogClient, times(2)).fetch(eq("openai"), any());
    }

    @Test
    void discoveryDisabledShouldNotQueryCatalogs() {
        ModelRegistryService service = service(tempDir.resolve("absent"), false);

        service.list();

        verify(catalogClient, never()).fetch(anyString(), any());
    }

    @Test
    void usageShouldSurviveRefresh() {
        ModelRegistryService service = service(tempDir.resolve("absent"), false);

        service.recordUsage("ollama:llama3.1", 42.5);
        service.refresh();

        ModelInfo model = service.find("ollama:llama3.1").orElseThrow();
        assertThat(model.lastUsed()).isNotNull();
        assertThat(model.tokensPerSecond()).isEqualTo(42.5);
    }

    private ModelRegistryService service(Path modelsDir, boolean discovery) {
        ModelCatalogProperties properties = new ModelCatalogProperties();
        properties.setExternalDir(modelsDir.toString());
        properties.setProviderDiscovery(discovery);
        return new ModelRegistryService(new ObjectMapper(), properties, providerProperties(), catalogClient);
    }

    private AgentProviderProperties providerProperties() {
        AgentProviderProperties properties = new AgentProviderProperties();
        Map<String, AgentProviderProperties.ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("ollama", provider(ProviderProtocol.OLLAMA, "llama3.1"));
        providers.put("openai", provider(ProviderProtocol.OPENAI_COMPATIBLE, null));
        properties.setProviders(providers);
        properties.setDefaultProvider("ollama");
        return properties;
    }

    private AgentProviderProperties.ProviderConfig provider(ProviderProtocol protocol, String model) {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setProtocol(protocol);
        config.setBaseUrl("http://localhost:1");
        config.setModel(model);
        return config;
    }
}
