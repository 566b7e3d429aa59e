package com.linlay.agentengine.model.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.config.ProviderProtocol;
import com.linlay.agentengine.model.ModelInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lists the models a provider advertises: Ollama {@code /api/tags}, OpenAI-compatible
 * {@code /models} (OpenRouter adds context length and per-token pricing).
 */
@Component
public class ProviderCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(ProviderCatalogClient.class);
    private static final Duration CATALOG_TIMEOUT = Duration.ofSeconds(15);
    private static final int OLLAMA_CONTEXT_WINDOW = 8192;

    private final WebClient.Builder webClientBuilder;

    public ProviderCatalogClient(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    public List<ModelInfo> fetch(String providerKey, AgentProviderProperties.ProviderConfig config) {
        if (config == null || !StringUtils.hasText(config.getBaseUrl()) || !config.isCatalogEnabled()) {
            return List.of();
        }
        ProviderProtocol protocol = config.getProtocol() == null ? ProviderProtocol.OPENAI_COMPATIBLE : config.getProtocol();
        try {
            return switch (protocol) {
                case OLLAMA -> fetchOllama(providerKey, config);
                case OPENAI_COMPATIBLE -> fetchOpenAiCompatible(providerKey, config);
                case ANTHROPIC -> List.of();
            };
        } catch (Exception ex) {
            log.warn("Cannot load model catalog of provider '{}' from {}: {}", providerKey, config.getBaseUrl(), ex.getMessage());
            return List.of();
        }
    }

    /**
     * Raw OpenAI-compatible {@code /models} payload, shared with the pricing lookup.
     */
    public JsonNode fetchModelsDocument(AgentProviderProperties.ProviderConfig config) {
        return client(config)
                .get()
                .uri(modelsPath(config.getBaseUrl()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(CATALOG_TIMEOUT);
    }

    private List<ModelInfo> fetchOllama(String providerKey, AgentProviderProperties.ProviderConfig config) {
        JsonNode root = client(config)
                .get()
                .uri("/api/tags")
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(CATALOG_TIMEOUT);
        List<ModelInfo> models = new ArrayList<>();
        if (root == null) {
            return models;
        }
        for (JsonNode node : root.path("models")) {
            String name = node.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            models.add(new ModelInfo(
                    ModelInfo.composeId(providerKey, name),
                    providerKey,
                    name,
                    config.getContextWindow() != null ? config.getContextWindow() : OLLAMA_CONTEXT_WINDOW,
                    0.0,
                    0.0,
                    true,
                    true,
                    null,
                    null
            ));
        }
        return models;
    }

    private List<ModelInfo> fetchOpenAiCompatible(String providerKey, AgentProviderProperties.ProviderConfig config) {
        JsonNode root = fetchModelsDocument(config);
        List<ModelInfo> models = new ArrayList<>();
        if (root == null) {
            return models;
        }
        for (JsonNode node : root.path("data")) {
            String id = node.path("id").asText("");
            if (id.isBlank()) {
                continue;
            }
            JsonNode pricing = node.path("pricing");
            JsonNode parameters = node.path("supported_parameters");
            boolean supportsTools = true;
            if (parameters.isArray()) {
                supportsTools = false;
                for (JsonNode parameter : parameters) {
                    if ("tools".equals(parameter.asText())) {
                        supportsTools = true;
                        break;
                    }
                }
            }
            models.add(new ModelInfo(
                    ModelInfo.composeId(providerKey, id),
                    providerKey,
                    node.path("name").asText(id),
                    node.hasNonNull("context_length") ? node.get("context_length").asInt() : config.getContextWindow(),
                    perMillion(pricing.path("prompt")),
                    perMillion(pricing.path("completion")),
                    supportsTools,
                    true,
                    null,
                    null
            ));
        }
        return models;
    }

    private Double perMillion(JsonNode perTokenPrice) {
        if (perTokenPrice == null || perTokenPrice.isMissingNode() || perTokenPrice.isNull()) {
            return null;
        }
        try {
            return Double.parseDouble(perTokenPrice.asText()) * 1_000_000d;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private WebClient client(AgentProviderProperties.ProviderConfig config) {
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(config.getBaseUrl());
        if (StringUtils.hasText(config.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private String modelsPath(String baseUrl) {
        String normalized = baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return "/models";
        }
        return "/v1/models";
    }
}
