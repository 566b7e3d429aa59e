package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelCapabilities;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.model.ToolDefinition;
import com.linlay.agentengine.stream.adapter.ollama.OllamaChunk;
import com.linlay.agentengine.stream.adapter.ollama.OllamaChunkParser;
import com.linlay.agentengine.stream.model.StreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Local Ollama server, {@code /api/chat} with newline-delimited JSON streaming.
 */
public class OllamaModelAdapter extends AbstractHttpModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(OllamaModelAdapter.class);
    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");
    static final int DEFAULT_CONTEXT_WINDOW = 8192;

    private final OllamaChunkParser chunkParser;

    public OllamaModelAdapter(
            String provider,
            String model,
            AgentProviderProperties.ProviderConfig config,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        super(provider, model, config, webClientBuilder, objectMapper);
        this.chunkParser = new OllamaChunkParser(objectMapper);
    }

    @Override
    protected void applyDefaultHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(config.getApiKey())) {
            headers.setBearerAuth(config.getApiKey());
        }
    }

    @Override
    protected String healthCheckPath() {
        return "/api/tags";
    }

    @Override
    public GenerateResponse generate(GenerateRequest request) {
        long start = System.nanoTime();
        JsonNode root;
        try {
            root = webClient.post()
                    .uri("/api/chat")
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestBody(request, false))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception ex) {
            log.error("Ollama request failed model={} in {} ms", model, elapsedMs(start), ex);
            throw wrap(ex);
        }
        if (root == null) {
            throw wrap(new IllegalStateException("Empty response body"));
        }
        OllamaChunk chunk;
        try {
            chunk = chunkParser.parse(root);
        } catch (IllegalStateException ex) {
            throw wrap(ex);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (root.hasNonNull("model")) {
            metadata.put("model", root.get("model").asText());
        }
        if (root.hasNonNull("total_duration")) {
            metadata.put("totalDurationNs", root.get("total_duration").asLong());
        }
        log.debug("Ollama request finished model={} in {} ms", model, elapsedMs(start));
        return new GenerateResponse(chunk.content(), chunk.toolCalls(), chunk.usage(), chunk.doneReason(), metadata);
    }

    @Override
    public Flux<StreamChunk> generateStream(GenerateRequest request) {
        return Flux.defer(() -> {
            AtomicBoolean doneSeen = new AtomicBoolean(false);
            long start = System.nanoTime();
            return webClient.post()
                    .uri("/api/chat")
                    .accept(NDJSON)
                    .bodyValue(buildRequestBody(request, true))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .concatMapIterable(line -> {
                        OllamaChunk chunk = chunkParser.parseOrNull(line);
                        if (chunk == null || doneSeen.get()) {
                            return List.<StreamChunk>of();
                        }
                        List<StreamChunk> chunks = new ArrayList<>();
                        if (StringUtils.hasLength(chunk.content())) {
                            chunks.add(StreamChunk.content(chunk.content()));
                        }
                        chunk.toolCalls().forEach(call -> chunks.add(StreamChunk.toolCall(call)));
                        if (chunk.done()) {
                            doneSeen.set(true);
                            chunks.add(StreamChunk.done(chunk.usage()));
                        }
                        return chunks;
                    })
                    .concatWith(Flux.defer(() -> doneSeen.get()
                            ? Flux.empty()
                            : Flux.just(StreamChunk.done(null))))
                    .timeout(timeout)
                    .doOnComplete(() -> log.debug("Ollama stream finished model={} in {} ms", model, elapsedMs(start)))
                    .onErrorResume(ex -> {
                        log.error("Ollama stream failed model={} in {} ms", model, elapsedMs(start), ex);
                        return Flux.just(StreamChunk.error(wrap(ex).getMessage()));
                    });
        });
    }

    @Override
    public ModelCapabilities capabilities() {
        int contextWindow = config.getContextWindow() != null ? config.getContextWindow() : DEFAULT_CONTEXT_WINDOW;
        return new ModelCapabilities(contextWindow, true, true, false);
    }

    Map<String, Object> buildRequestBody(GenerateRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", buildMessages(request));
        body.put("stream", stream);

        ModelSettings settings = request.settings();
        Map<String, Object> options = new LinkedHashMap<>();
        if (settings.temperature() != null) {
            options.put("temperature", settings.temperature());
        }
        if (settings.maxTokens() != null && settings.maxTokens() > 0) {
            options.put("num_predict", settings.maxTokens());
        }
        if (settings.topP() != null) {
            options.put("top_p", settings.topP());
        }
        if (!settings.stopSequences().isEmpty()) {
            options.put("stop", settings.stopSequences());
        }
        if (!options.isEmpty()) {
            body.put("options", options);
        }
        if (!request.tools().isEmpty()) {
            body.put("tools", buildTools(request.tools()));
        }
        return body;
    }

    private List<Map<String, Object>> buildMessages(GenerateRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (StringUtils.hasText(request.systemPrompt())) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        for (Message message : request.messages()) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("role", message.role().wireName());
            raw.put("content", message.content());
            if (message.hasToolCalls()) {
                List<Map<String, Object>> toolCalls = new ArrayList<>();
                for (ToolCall call : message.toolCalls()) {
                    toolCalls.add(Map.of("function", Map.of("name", call.name(), "arguments", call.parameters())));
                }
                raw.put("tool_calls", toolCalls);
            }
            messages.add(raw);
        }
        return messages;
    }

    private List<Map<String, Object>> buildTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            rawTools.add(Map.of(
                    "type", "function",
                    "function", Map.of(
                            "name", tool.name(),
                            "description", tool.description(),
                            "parameters", tool.parameters()
                    )
            ));
        }
        return rawTools;
    }
}
