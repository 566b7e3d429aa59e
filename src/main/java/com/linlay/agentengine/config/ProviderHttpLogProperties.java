package com.linlay.agentengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Request/response logging of the provider WebClient. Header values listed in
 * {@code masked-headers} are replaced before they reach the log.
 */
@ConfigurationProperties(prefix = "agent.llm.http-log")
public class ProviderHttpLogProperties {

    private boolean enabled = false;
    private boolean maskSensitive = true;
    private List<String> maskedHeaders = new ArrayList<>(List.of("authorization", "x-api-key", "api-key"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public List<String> getMaskedHeaders() {
        return maskedHeaders;
    }

    public void setMaskedHeaders(List<String> maskedHeaders) {
        this.maskedHeaders = maskedHeaders == null ? new ArrayList<>() : maskedHeaders;
    }

    public boolean isMasked(String headerName) {
        if (!maskSensitive || headerName == null) {
            return false;
        }
        String normalized = headerName.toLowerCase(Locale.ROOT);
        return maskedHeaders.stream().anyMatch(header -> header.equalsIgnoreCase(normalized));
    }
}
