package com.linlay.agentengine.stream.adapter.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.stream.adapter.ToolCallAccumulator;
import com.linlay.agentengine.stream.model.StreamChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns Anthropic Messages API stream events into normalized chunks. {@code tool_use} blocks are
 * accumulated from {@code input_json_delta} fragments and released when their block stops.
 * One instance per stream.
 */
public class AnthropicStreamAssembler {

    private static final Logger log = LoggerFactory.getLogger(AnthropicStreamAssembler.class);

    private final ObjectMapper objectMapper;
    private final ToolCallAccumulator accumulator;
    private long inputTokens;
    private long outputTokens;
    private boolean finished;

    public AnthropicStreamAssembler(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.accumulator = new ToolCallAccumulator(objectMapper);
    }

    public List<StreamChunk> onEvent(String rawEvent) {
        String payload = normalizePayload(rawEvent);
        if (payload == null || finished) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception ex) {
            log.warn("Failed to parse Anthropic SSE event: {}", rawEvent, ex);
            return List.of();
        }
        String type = root.path("type").asText("");
        switch (type) {
            case "message_start" -> {
                JsonNode usage = root.path("message").path("usage");
                inputTokens = usage.path("input_tokens").asLong(inputTokens);
                outputTokens = usage.path("output_tokens").asLong(outputTokens);
                return List.of();
            }
            case "content_block_start" -> {
                JsonNode block = root.path("content_block");
                if ("tool_use".equals(block.path("type").asText())) {
                    accumulator.append(root.path("index").asInt(), block.path("id").asText(null),
                            block.path("name").asText(null), null);
                } else if (StringUtils.hasText(block.path("text").asText(""))) {
                    return List.of(StreamChunk.content(block.path("text").asText()));
                }
                return List.of();
            }
            case "content_block_delta" -> {
                JsonNode delta = root.path("delta");
                String deltaType = delta.path("type").asText("");
                if ("text_delta".equals(deltaType)) {
                    String text = delta.path("text").asText("");
                    return text.isEmpty() ? List.of() : List.of(StreamChunk.content(text));
                }
                if ("input_json_delta".equals(deltaType)) {
                    accumulator.append(root.path("index").asInt(), null, null, delta.path("partial_json").asText(""));
                }
                return List.of();
            }
            case "content_block_stop" -> {
                return releaseToolCalls();
            }
            case "message_delta" -> {
                outputTokens = root.path("usage").path("output_tokens").asLong(outputTokens);
                return List.of();
            }
            case "message_stop" -> {
                return finish();
            }
            case "error" -> {
                finished = true;
                return List.of(StreamChunk.error(root.path("error").path("message").asText("unknown error")));
            }
            default -> {
                return List.of();
            }
        }
    }

    /**
     * Flushes pending tool calls and emits the terminal {@code DONE}. Idempotent.
     */
    public List<StreamChunk> finish() {
        if (finished) {
            return List.of();
        }
        finished = true;
        List<StreamChunk> chunks = new ArrayList<>(releaseToolCalls());
        chunks.add(StreamChunk.done(new TokenUsage(inputTokens, outputTokens)));
        return chunks;
    }

    private List<StreamChunk> releaseToolCalls() {
        if (accumulator.isEmpty()) {
            return List.of();
        }
        List<StreamChunk> chunks = new ArrayList<>();
        for (ToolCall call : accumulator.drain()) {
            chunks.add(StreamChunk.toolCall(call));
        }
        return chunks;
    }

    private String normalizePayload(String rawEvent) {
        if (!StringUtils.hasText(rawEvent)) {
            return null;
        }
        String payload = rawEvent.trim();
        if (payload.startsWith("event:")) {
            int dataStart = payload.indexOf("data:");
            if (dataStart < 0) {
                return null;
            }
            payload = payload.substring(dataStart);
        }
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        return payload.isEmpty() ? null : payload;
    }
}
