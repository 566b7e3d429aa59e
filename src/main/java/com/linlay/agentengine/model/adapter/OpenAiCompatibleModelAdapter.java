package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelCapabilities;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.model.ToolDefinition;
import com.linlay.agentengine.stream.adapter.ToolCallAccumulator;
import com.linlay.agentengine.stream.adapter.openai.OpenAiSseDeltaParser;
import com.linlay.agentengine.stream.model.LlmDelta;
import com.linlay.agentengine.stream.model.StreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OpenAI chat-completions protocol, used for OpenRouter, OpenAI and compatible gateways.
 * Tool-call arguments stream as string fragments keyed by index and are only parsed once the
 * stream is over.
 */
public class OpenAiCompatibleModelAdapter extends AbstractHttpModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleModelAdapter.class);
    static final int DEFAULT_CONTEXT_WINDOW = 128_000;

    private final OpenAiSseDeltaParser deltaParser;

    public OpenAiCompatibleModelAdapter(
            String provider,
            String model,
            AgentProviderProperties.ProviderConfig config,
            WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper
    ) {
        super(provider, model, config, webClientBuilder, objectMapper);
        this.deltaParser = new OpenAiSseDeltaParser(objectMapper);
    }

    @Override
    protected void applyDefaultHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(config.getApiKey())) {
            headers.setBearerAuth(config.getApiKey());
        }
    }

    @Override
    protected String healthCheckPath() {
        return apiPath("/models");
    }

    @Override
    public GenerateResponse generate(GenerateRequest request) {
        long start = System.nanoTime();
        log.debug("LLM request start provider={}, model={}, messages={}, tools={}",
                provider, model, request.messages().size(), request.tools().size());
        JsonNode root;
        try {
            root = webClient.post()
                    .uri(apiPath("/chat/completions"))
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestBody(request, false))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception ex) {
            log.error("LLM request failed provider={}, model={} in {} ms", provider, model, elapsedMs(start), ex);
            throw wrap(ex);
        }
        if (root == null) {
            throw wrap(new IllegalStateException("Empty response body"));
        }
        if (root.hasNonNull("error")) {
            throw wrap(new IllegalStateException(root.path("error").path("message").asText(root.path("error").toString())));
        }
        GenerateResponse response = parseResponse(root);
        log.debug("LLM request finished provider={}, model={} in {} ms, toolCalls={}",
                provider, model, elapsedMs(start), response.toolCalls().size());
        return response;
    }

    @Override
    public Flux<StreamChunk> generateStream(GenerateRequest request) {
        return Flux.defer(() -> {
            ToolCallAccumulator accumulator = new ToolCallAccumulator(objectMapper);
            AtomicReference<TokenUsage> usage = new AtomicReference<>(TokenUsage.ZERO);
            AtomicBoolean firstChunkReceived = new AtomicBoolean(false);
            long start = System.nanoTime();

            return webClient.post()
                    .uri(apiPath("/chat/completions"))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(buildRequestBody(request, true))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .doOnNext(chunk -> firstChunkReceived.set(true))
                    .retryWhen(Retry.max(1)
                            .filter(ex -> !firstChunkReceived.get() && isConnectionError(ex)))
                    .takeUntil(OpenAiSseDeltaParser::isDoneMarker)
                    .concatMapIterable(rawChunk -> toChunks(rawChunk, accumulator, usage))
                    .concatWith(Flux.defer(() -> {
                        List<StreamChunk> tail = new ArrayList<>();
                        accumulator.drain().forEach(call -> tail.add(StreamChunk.toolCall(call)));
                        tail.add(StreamChunk.done(usage.get()));
                        return Flux.fromIterable(tail);
                    }))
                    .timeout(timeout)
                    .doOnComplete(() -> log.debug("LLM stream finished provider={}, model={} in {} ms",
                            provider, model, elapsedMs(start)))
                    .onErrorResume(ex -> {
                        log.error("LLM stream failed provider={}, model={} in {} ms", provider, model, elapsedMs(start), ex);
                        return Flux.just(StreamChunk.error(wrap(ex).getMessage()));
                    });
        });
    }

    @Override
    public ModelCapabilities capabilities() {
        int contextWindow = config.getContextWindow() != null ? config.getContextWindow() : DEFAULT_CONTEXT_WINDOW;
        return new ModelCapabilities(contextWindow, true, true, false);
    }

    private List<StreamChunk> toChunks(String rawChunk, ToolCallAccumulator accumulator, AtomicReference<TokenUsage> usage) {
        LlmDelta delta = deltaParser.parseOrNull(rawChunk);
        if (delta == null) {
            return List.of();
        }
        if (delta.toolCalls() != null) {
            delta.toolCalls().forEach(accumulator::accept);
        }
        if (delta.usage() != null) {
            usage.set(toUsage(delta.usage()));
        }
        if (StringUtils.hasLength(delta.content())) {
            return List.of(StreamChunk.content(delta.content()));
        }
        return List.of();
    }

    Map<String, Object> buildRequestBody(GenerateRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", buildMessages(request));
        body.put("stream", stream);
        if (stream) {
            body.put("stream_options", Map.of("include_usage", true));
        }
        ModelSettings settings = request.settings();
        if (settings.temperature() != null) {
            body.put("temperature", settings.temperature());
        }
        if (settings.maxTokens() != null && settings.maxTokens() > 0) {
            body.put("max_tokens", settings.maxTokens());
        }
        if (settings.topP() != null) {
            body.put("top_p", settings.topP());
        }
        if (!settings.stopSequences().isEmpty()) {
            body.put("stop", settings.stopSequences());
        }
        if (!request.tools().isEmpty()) {
            body.put("tools", buildTools(request.tools()));
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private List<Map<String, Object>> buildMessages(GenerateRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (StringUtils.hasText(request.systemPrompt())) {
            messages.add(textMessage("system", request.systemPrompt()));
        }
        for (Message message : request.messages()) {
            switch (message.role()) {
                case ASSISTANT -> messages.add(assistantMessage(message));
                case TOOL -> {
                    Map<String, Object> tool = new LinkedHashMap<>();
                    tool.put("role", "tool");
                    tool.put("tool_call_id", message.toolCallId());
                    tool.put("content", message.content());
                    messages.add(tool);
                }
                default -> messages.add(textMessage(message.role().wireName(), message.content()));
            }
        }
        return messages;
    }

    private Map<String, Object> assistantMessage(Message message) {
        Map<String, Object> assistant = new LinkedHashMap<>();
        assistant.put("role", "assistant");
        assistant.put("content", message.content());
        if (message.hasToolCalls()) {
            List<Map<String, Object>> toolCalls = new ArrayList<>();
            for (ToolCall call : message.toolCalls()) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", call.name());
                function.put("arguments", toJson(call.parameters()));
                Map<String, Object> toolCall = new LinkedHashMap<>();
                toolCall.put("id", call.id());
                toolCall.put("type", "function");
                toolCall.put("function", function);
                toolCalls.add(toolCall);
            }
            assistant.put("tool_calls", toolCalls);
        }
        return assistant;
    }

    private Map<String, Object> textMessage(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content == null ? "" : content);
        return message;
    }

    private List<Map<String, Object>> buildTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> rawTools = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            if (StringUtils.hasText(tool.description())) {
                function.put("description", tool.description());
            }
            function.put("parameters", tool.parameters());
            Map<String, Object> toolMap = new LinkedHashMap<>();
            toolMap.put("type", "function");
            toolMap.put("function", function);
            rawTools.add(toolMap);
        }
        return rawTools;
    }

    private GenerateResponse parseResponse(JsonNode root) {
        JsonNode choice = root.path("choices").path(0);
        JsonNode message = choice.path("message");
        List<ToolCall> toolCalls = new ArrayList<>();
        JsonNode toolCallsNode = message.path("tool_calls");
        if (toolCallsNode.isArray()) {
            ToolCallAccumulator accumulator = new ToolCallAccumulator(objectMapper);
            int index = 0;
            for (JsonNode toolCallNode : toolCallsNode) {
                JsonNode function = toolCallNode.path("function");
                String id = toolCallNode.path("id").asText("");
                JsonNode arguments = function.path("arguments");
                accumulator.append(
                        index++,
                        id.isBlank() ? "call_" + UUID.randomUUID() : id,
                        function.path("name").asText(null),
                        arguments.isTextual() ? arguments.asText() : arguments.isMissingNode() ? null : arguments.toString()
                );
            }
            toolCalls.addAll(accumulator.drain());
        }
        JsonNode usageNode = root.path("usage");
        TokenUsage usage = new TokenUsage(
                usageNode.path("prompt_tokens").asLong(0),
                usageNode.path("completion_tokens").asLong(0)
        );
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (root.hasNonNull("id")) {
            metadata.put("id", root.get("id").asText());
        }
        if (root.hasNonNull("model")) {
            metadata.put("model", root.get("model").asText());
        }
        String finishReason = choice.hasNonNull("finish_reason") ? choice.get("finish_reason").asText() : null;
        return new GenerateResponse(message.path("content").asText(""), toolCalls, usage, finishReason, metadata);
    }

    private TokenUsage toUsage(Map<String, Object> usage) {
        return new TokenUsage(longValue(usage.get("prompt_tokens")), longValue(usage.get("completion_tokens")));
    }

    private long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
