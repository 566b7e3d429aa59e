package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.MessageRole;
import com.linlay.agentengine.model.ModelCapabilities;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.model.ToolDefinition;
import com.linlay.agentengine.stream.adapter.anthropic.AnthropicStreamAssembler;
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

/**
 * Anthropic Messages API. System-role buffer entries (memory, summaries) are folded into the
 * top-level system prompt; tool results travel as {@code tool_result} blocks of a user message.
 */
public class AnthropicModelAdapter extends AbstractHttpModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(AnthropicModelAdapter.class);
    private static final String API_VERSION = "2023-06-01";
    static final int DEFAULT_CONTEXT_WINDOW = 200_000;
    static final int DEFAULT_MAX_TOKENS = 4096;

    public AnthropicModelAdapter(
            String provider,
            String model,
            AgentProviderProperties.ProviderConfig config,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        super(provider, model, config, webClientBuilder, objectMapper);
    }

    @Override
    protected void applyDefaultHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(config.getApiKey())) {
            headers.set("x-api-key", config.getApiKey());
        }
        headers.set("anthropic-version", API_VERSION);
    }

    @Override
    protected String healthCheckPath() {
        return apiPath("/models");
    }

    @Override
    public GenerateResponse generate(GenerateRequest request) {
        long start = System.nanoTime();
        JsonNode root;
        try {
            root = webClient.post()
                    .uri(apiPath("/messages"))
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestBody(request, false))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception ex) {
            log.error("Anthropic request failed model={} in {} ms", model, elapsedMs(start), ex);
            throw wrap(ex);
        }
        if (root == null) {
            throw wrap(new IllegalStateException("Empty response body"));
        }
        if ("error".equals(root.path("type").asText())) {
            throw wrap(new IllegalStateException(root.path("error").path("message").asText("unknown error")));
        }

        StringBuilder content = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : root.path("content")) {
            String type = block.path("type").asText();
            if ("text".equals(type)) {
                content.append(block.path("text").asText(""));
            } else if ("tool_use".equals(type)) {
                JsonNode input = block.path("input");
                toolCalls.add(new ToolCall(
                        block.path("id").asText(),
                        block.path("name").asText(),
                        input.isObject() ? objectMapper.convertValue(input, MAP_TYPE) : Map.of()
                ));
            }
        }
        JsonNode usage = root.path("usage");
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (root.hasNonNull("id")) {
            metadata.put("id", root.get("id").asText());
        }
        log.debug("Anthropic request finished model={} in {} ms", model, elapsedMs(start));
        return new GenerateResponse(
                content.toString(),
                toolCalls,
                new TokenUsage(usage.path("input_tokens").asLong(0), usage.path("output_tokens").asLong(0)),
                root.hasNonNull("stop_reason") ? root.get("stop_reason").asText() : null,
                metadata
        );
    }

    @Override
    public Flux<StreamChunk> generateStream(GenerateRequest request) {
        return Flux.defer(() -> {
            AnthropicStreamAssembler assembler = new AnthropicStreamAssembler(objectMapper);
            long start = System.nanoTime();
            return webClient.post()
                    .uri(apiPath("/messages"))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(buildRequestBody(request, true))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .concatMapIterable(assembler::onEvent)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(assembler.finish())))
                    .takeUntil(chunk -> chunk.type() == StreamChunk.Type.ERROR)
                    .timeout(timeout)
                    .doOnComplete(() -> log.debug("Anthropic stream finished model={} in {} ms", model, elapsedMs(start)))
                    .onErrorResume(ex -> {
                        log.error("Anthropic stream failed model={} in {} ms", model, elapsedMs(start), ex);
                        return Flux.just(StreamChunk.error(wrap(ex).getMessage()));
                    });
        });
    }

    @Override
    public ModelCapabilities capabilities() {
        int contextWindow = config.getContextWindow() != null ? config.getContextWindow() : DEFAULT_CONTEXT_WINDOW;
        return new ModelCapabilities(contextWindow, true, true, true);
    }

    Map<String, Object> buildRequestBody(GenerateRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);

        StringBuilder system = new StringBuilder();
        if (StringUtils.hasText(request.systemPrompt())) {
            system.append(request.systemPrompt());
        }
        List<Map<String, Object>> messages = new ArrayList<>();
        List<Map<String, Object>> pendingToolResults = new ArrayList<>();
        for (Message message : request.messages()) {
            if (message.role() != MessageRole.TOOL && !pendingToolResults.isEmpty()) {
                messages.add(Map.of("role", "user", "content", List.copyOf(pendingToolResults)));
                pendingToolResults.clear();
            }
            switch (message.role()) {
                case SYSTEM -> {
                    if (system.length() > 0) {
                        system.append("\n\n");
                    }
                    system.append(message.content());
                }
                case TOOL -> {
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("type", "tool_result");
                    result.put("tool_use_id", message.toolCallId());
                    result.put("content", message.content());
                    pendingToolResults.add(result);
                }
                case ASSISTANT -> messages.add(Map.of("role", "assistant", "content", assistantBlocks(message)));
                case USER -> messages.add(Map.of("role", "user", "content", message.content()));
            }
        }
        if (!pendingToolResults.isEmpty()) {
            messages.add(Map.of("role", "user", "content", List.copyOf(pendingToolResults)));
        }
        if (system.length() > 0) {
            body.put("system", system.toString());
        }
        body.put("messages", messages);

        ModelSettings settings = request.settings();
        body.put("max_tokens", settings.maxTokens() != null && settings.maxTokens() > 0
                ? settings.maxTokens()
                : DEFAULT_MAX_TOKENS);
        if (settings.temperature() != null) {
            body.put("temperature", settings.temperature());
        }
        if (settings.topP() != null) {
            body.put("top_p", settings.topP());
        }
        if (!settings.stopSequences().isEmpty()) {
            body.put("stop_sequences", settings.stopSequences());
        }
        if (!request.tools().isEmpty()) {
            body.put("tools", buildTools(request.tools()));
        }
        body.put("stream", stream);
        return body;
    }

    private List<Map<String, Object>> assistantBlocks(Message message) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (StringUtils.hasText(message.content())) {
            blocks.add(Map.of("type", "text", "text", message.content()));
        }
        for (ToolCall call : message.toolCalls()) {
            blocks.add(Map.of(
                    "type", "tool_use",
                    "id", call.id(),
                    "name", call.name(),
                    "input", call.parameters()
            ));
        }
        return blocks;
    }

    private List<Map<String, Object>> buildTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            rawTools.add(Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "input_schema", tool.parameters()
            ));
        }
        return rawTools;
    }
}
