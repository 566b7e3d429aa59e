package com.linlay.agentengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Shared WebClient for model providers: pooled Reactor Netty connections, a raised codec
 * buffer for large completions and optional header-masked request logging.
 */
@Configuration
public class WebClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfiguration.class);

    @Bean
    public ConnectionProvider llmConnectionProvider() {
        return ConnectionProvider.builder("llm-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder llmWebClientBuilder(
            ProviderHttpLogProperties logProperties,
            ConnectionProvider llmConnectionProvider) {
        HttpClient httpClient = HttpClient.create(llmConnectionProvider);
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (!logProperties.isEnabled()) {
            return builder;
        }

        return builder.filter((request, next) -> {
            log.info("[provider-http][request] {} {}", request.method(), request.url());
            log.info("[provider-http][request-headers] {}", maskHeaders(request.headers(), logProperties));
            return next.exchange(request)
                    .doOnNext(logResponse(request));
        });
    }

    private Consumer<ClientResponse> logResponse(ClientRequest request) {
        return response -> log.info(
                "[provider-http][response] {} {} status={}",
                request.method(),
                request.url(),
                response.statusCode().value()
        );
    }

    static Map<String, List<String>> maskHeaders(HttpHeaders headers, ProviderHttpLogProperties properties) {
        Map<String, List<String>> masked = new LinkedHashMap<>();
        headers.forEach((name, values) -> masked.put(name, properties.isMasked(name) ? List.of("******") : values));
        return masked;
    }
}
