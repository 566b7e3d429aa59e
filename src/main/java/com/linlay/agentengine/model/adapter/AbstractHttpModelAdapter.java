package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.error.ModelException;
import com.linlay.agentengine.model.HealthStatus;
import com.linlay.agentengine.model.ModelAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing of the WebClient based adapters: client construction, error wrapping and
 * health probing.
 */
abstract class AbstractHttpModelAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpModelAdapter.class);
    private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(10);
    protected static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    protected final String provider;
    protected final String model;
    protected final AgentProviderProperties.ProviderConfig config;
    protected final ObjectMapper objectMapper;
    protected final WebClient webClient;
    protected final Duration timeout;

    protected AbstractHttpModelAdapter(
            String provider,
            String model,
            AgentProviderProperties.ProviderConfig config,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        if (config == null || !StringUtils.hasText(config.getBaseUrl())) {
            throw new ModelException(provider, "Missing base-url for provider");
        }
        this.provider = provider;
        this.model = model;
        this.config = config;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofMillis(config.getTimeoutMs() > 0 ? config.getTimeoutMs() : 60_000L);
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(this::applyDefaultHeaders)
                .build();
    }

    protected abstract void applyDefaultHeaders(HttpHeaders headers);

    protected abstract String healthCheckPath();

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public HealthStatus healthCheck() {
        long start = System.nanoTime();
        try {
            webClient.get()
                    .uri(healthCheckPath())
                    .retrieve()
                    .toBodilessEntity()
                    .block(HEALTH_CHECK_TIMEOUT);
            return HealthStatus.up(elapsedMs(start));
        } catch (Exception ex) {
            log.debug("Health check failed provider={}, model={}", provider, model, ex);
            return HealthStatus.down(elapsedMs(start), describe(ex));
        }
    }

    protected ModelException wrap(Throwable ex) {
        if (ex instanceof ModelException modelException) {
            return modelException;
        }
        return new ModelException(provider, describe(ex), ex);
    }

    protected String describe(Throwable ex) {
        if (ex instanceof WebClientResponseException responseException) {
            String body = responseException.getResponseBodyAsString();
            return "HTTP %d: %s".formatted(
                    responseException.getStatusCode().value(),
                    StringUtils.hasText(body) ? body : responseException.getStatusText()
            );
        }
        if (ex instanceof TimeoutException) {
            return "Request timed out after " + timeout.toMillis() + " ms";
        }
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }

    protected String apiPath(String path) {
        String normalized = config.getBaseUrl().trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return path;
        }
        return "/v1" + path;
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception ex) {
            throw new ModelException(provider, "Cannot serialize tool arguments", ex);
        }
    }

    protected static boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }

    protected static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
