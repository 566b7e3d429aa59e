package com.linlay.agentengine.model;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.models")
public class ModelCatalogProperties {

    /**
     * Directory of {@code *.json} model definitions. Missing directory means "none".
     */
    private String externalDir = "models";

    /**
     * Whether provider catalogs (Ollama tags, OpenRouter models) are queried on refresh.
     */
    private boolean providerDiscovery = true;

    public String getExternalDir() {
        return externalDir;
    }

    public void setExternalDir(String externalDir) {
        this.externalDir = externalDir;
    }

    public boolean isProviderDiscovery() {
        return providerDiscovery;
    }

    public void setProviderDiscovery(boolean providerDiscovery) {
        this.providerDiscovery = providerDiscovery;
    }
}
