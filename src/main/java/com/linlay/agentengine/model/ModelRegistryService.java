package com.linlay.agentengine.model;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.model.catalog.ProviderCatalogClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Catalog of known models. Entries come from each provider's configured default model, the
 * provider catalogs and the model definition files, later sources overriding earlier ones.
 * The snapshot is swapped atomically; a lookup miss triggers one refresh.
 */
@Service
public class ModelRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistryService.class);

    private final ObjectMapper objectMapper;
    private final ModelCatalogProperties properties;
    private final AgentProviderProperties providerProperties;
    private final ProviderCatalogClient catalogClient;

    private final Object reloadLock = new Object();
    private volatile Map<String, ModelInfo> byId = Map.of();
    private volatile boolean loaded;

    public ModelRegistryService(
            ObjectMapper objectMapper,
            ModelCatalogProperties properties,
            AgentProviderProperties providerProperties,
            ProviderCatalogClient catalogClient
    ) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.providerProperties = providerProperties;
        this.catalogClient = catalogClient;
    }

    public List<ModelInfo> list() {
        ensureLoaded();
        return byId.values().stream()
                .sorted(Comparator.comparing(ModelInfo::id))
                .toList();
    }

    public Optional<ModelInfo> find(String modelId) {
        String key = normalizeId(modelId);
        if (key == null) {
            return Optional.empty();
        }
        ensureLoaded();
        ModelInfo info = byId.get(key);
        if (info == null) {
            log.debug("Model '{}' not in registry, refreshing", key);
            refresh();
            info = byId.get(key);
        }
        return Optional.ofNullable(info);
    }

    public void refresh() {
        synchronized (reloadLock) {
            Map<String, ModelInfo> next = new LinkedHashMap<>();
            providerProperties.getProviders().forEach((providerKey, config) -> {
                if (config != null && StringUtils.hasText(config.getModel())) {
                    ModelInfo configured = configuredDefault(providerKey, config);
                    next.put(configured.id(), configured);
                }
            });
            if (properties.isProviderDiscovery()) {
                providerProperties.getProviders().forEach((providerKey, config) ->
                        catalogClient.fetch(providerKey, config).forEach(model -> next.put(model.id(), model)));
            }
            loadDefinitionFiles().forEach(model -> next.put(model.id(), model));

            Map<String, ModelInfo> previous = byId;
            next.replaceAll((id, model) -> {
                ModelInfo old = previous.get(id);
                return old == null || old.lastUsed() == null ? model : model.withUsage(old.lastUsed(), old.tokensPerSecond());
            });
            byId = Map.copyOf(next);
            loaded = true;
            log.debug("Refreshed model registry, size={}", next.size());
        }
    }

    /**
     * Records that a model served a request; {@code tokensPerSecond} may be null when unknown.
     */
    public void recordUsage(String modelId, Double tokensPerSecond) {
        String key = normalizeId(modelId);
        if (key == null) {
            return;
        }
        synchronized (reloadLock) {
            ModelInfo current = byId.get(key);
            if (current == null) {
                return;
            }
            Map<String, ModelInfo> next = new LinkedHashMap<>(byId);
            next.put(key, current.withUsage(Instant.now(), tokensPerSecond));
            byId = Map.copyOf(next);
        }
    }

    private void ensureLoaded() {
        if (!loaded) {
            refresh();
        }
    }

    private String normalizeId(String modelId) {
        if (!StringUtils.hasText(modelId)) {
            return null;
        }
        try {
            return ModelRef.parse(modelId, providerProperties.getDefaultProvider()).id();
        } catch (ValidationException ex) {
            return null;
        }
    }

    private ModelInfo configuredDefault(String providerKey, AgentProviderProperties.ProviderConfig config) {
        return new ModelInfo(
                ModelInfo.composeId(providerKey, config.getModel()),
                providerKey,
                config.getModel(),
                config.getContextWindow(),
                null,
                null,
                true,
                true,
                null,
                null
        );
    }

    private List<ModelInfo> loadDefinitionFiles() {
        if (!StringUtils.hasText(properties.getExternalDir())) {
            return List.of();
        }
        Path dir = Path.of(properties.getExternalDir()).toAbsolutePath().normalize();
        if (!Files.exists(dir)) {
            return List.of();
        }
        if (!Files.isDirectory(dir)) {
            log.warn("Configured models directory is not a directory: {}", dir);
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(path -> Files.isRegularFile(path) && path.getFileName().toString().endsWith(".json"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .map(this::tryLoad)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (IOException ex) {
            log.warn("Cannot list model files from {}", dir, ex);
            return List.of();
        }
    }

    private Optional<ModelInfo> tryLoad(Path file) {
        try {
            JsonNode root = objectMapper
                    .reader()
                    .with(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                    .with(JsonReadFeature.ALLOW_YAML_COMMENTS.mappedFeature())
                    .readTree(Files.readString(file));

            String provider = root.path("provider").asText("").trim().toLowerCase(Locale.ROOT);
            if (provider.isBlank()) {
                log.warn("Skip model file without provider: {}", file);
                return Optional.empty();
            }
            if (providerProperties.getProvider(provider) == null) {
                log.warn("Skip model file with unknown provider '{}': {}", provider, file);
                return Optional.empty();
            }
            String model = root.path("model").asText("").trim();
            if (model.isBlank()) {
                log.warn("Skip model file without model: {}", file);
                return Optional.empty();
            }
            return Optional.of(new ModelInfo(
                    ModelInfo.composeId(provider, model),
                    provider,
                    root.path("name").asText(model),
                    optionalInt(root, "contextWindow"),
                    optionalDouble(root, "inputCostPerMillion"),
                    optionalDouble(root, "outputCostPerMillion"),
                    root.path("supportsTools").asBoolean(true),
                    root.path("supportsStreaming").asBoolean(true),
                    null,
                    null
            ));
        } catch (Exception ex) {
            log.warn("Skip invalid model file: {}", file, ex);
            return Optional.empty();
        }
    }

    private Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.intValue() : null;
    }

    private Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.doubleValue() : null;
    }
}
