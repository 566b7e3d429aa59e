package com.linlay.agentengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "agent")
public class AgentProviderProperties {

    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    /**
     * Provider used for model ids without a {@code provider:} prefix.
     */
    private String defaultProvider = "ollama";

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public ProviderConfig getProvider(String key) {
        if (key == null) {
            return null;
        }
        ProviderConfig config = providers.get(key);
        return config != null ? config : providers.get(key.trim().toLowerCase(Locale.ROOT));
    }

    public String getDefaultProvider() {
        return defaultProvider;
    }

    public void setDefaultProvider(String defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public static class ProviderConfig {
        private ProviderProtocol protocol = ProviderProtocol.OPENAI_COMPATIBLE;
        private String baseUrl;
        private String apiKey;
        private String model;
        private long timeoutMs = 60_000L;
        private Integer contextWindow;
        private boolean catalogEnabled = true;

        public ProviderProtocol getProtocol() {
            return protocol;
        }

        public void setProtocol(ProviderProtocol protocol) {
            this.protocol = protocol;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public Integer getContextWindow() {
            return contextWindow;
        }

        public void setContextWindow(Integer contextWindow) {
            this.contextWindow = contextWindow;
        }

        public boolean isCatalogEnabled() {
            return catalogEnabled;
        }

        public void setCatalogEnabled(boolean catalogEnabled) {
            this.catalogEnabled = catalogEnabled;
        }
    }
}
