package com.linlay.agentengine.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientConfigurationTest {

    @Test
    void shouldMaskConfiguredHeadersCaseInsensitively() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("sk-secret");
        headers.set("X-Api-Key", "ant-secret");
        headers.set("anthropic-version", "2023-06-01");

        Map<String, List<String>> masked = WebClientConfiguration.maskHeaders(headers, new ProviderHttpLogProperties());

        assertThat(masked.get(HttpHeaders.AUTHORIZATION)).containsExactly("******");
        assertThat(masked.get("X-Api-Key")).containsExactly("******");
        assertThat(masked.get("anthropic-version")).containsExactly("2023-06-01");
    }

    @Test
    void shouldKeepValuesWhenMaskingDisabled() {
        ProviderHttpLogProperties properties = new ProviderHttpLogProperties();
        properties.setMaskSensitive(false);
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("sk-secret");

        assertThat(WebClientConfiguration.maskHeaders(headers, properties).get(HttpHeaders.AUTHORIZATION))
                .containsExactly("Bearer sk-secret");
    }
}
