package com.linlay.agentengine.stream.adapter.ollama;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Parses one NDJSON line (or a non-streaming body) of the Ollama {@code /api/chat} endpoint.
 * Ollama ships tool calls complete, with arguments as a JSON object.
 */
public class OllamaChunkParser {

    private static final Logger log = LoggerFactory.getLogger(OllamaChunkParser.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public OllamaChunkParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public OllamaChunk parseOrNull(String line) {
        if (!StringUtils.hasText(line)) {
            return null;
        }
        try {
            return parse(objectMapper.readTree(line.trim()));
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Failed to parse Ollama chunk: {}", line, ex);
            return null;
        }
    }

    public OllamaChunk parse(JsonNode root) {
        if (root.hasNonNull("error")) {
            throw new IllegalStateException(root.path("error").asText());
        }
        JsonNode message = root.path("message");
        String content = message.path("content").asText("");
        List<ToolCall> toolCalls = new ArrayList<>();
        JsonNode toolCallsNode = message.path("tool_calls");
        if (toolCallsNode.isArray()) {
            for (JsonNode toolCallNode : toolCallsNode) {
                JsonNode function = toolCallNode.path("function");
                String name = function.path("name").asText("");
                if (name.isBlank()) {
                    continue;
                }
                String id = toolCallNode.path("id").asText("");
                toolCalls.add(new ToolCall(
                        id.isBlank() ? "call_" + UUID.randomUUID() : id,
                        name,
                        readArguments(name, function.get("arguments"))
                ));
            }
        }
        boolean done = root.path("done").asBoolean(false);
        TokenUsage usage = done
                ? new TokenUsage(root.path("prompt_eval_count").asLong(0), root.path("eval_count").asLong(0))
                : null;
        String doneReason = root.hasNonNull("done_reason") ? root.get("done_reason").asText() : null;
        return new OllamaChunk(content, toolCalls, done, usage, doneReason);
    }

    private Map<String, Object> readArguments(String toolName, JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        try {
            if (arguments.isTextual()) {
                Map<String, Object> parsed = objectMapper.readValue(arguments.asText(), MAP_TYPE);
                return parsed == null ? Map.of() : parsed;
            }
            if (arguments.isObject()) {
                return objectMapper.convertValue(arguments, MAP_TYPE);
            }
        } catch (Exception ex) {
            log.warn("Unparsable arguments for Ollama tool call '{}', using empty parameters", toolName);
        }
        return Map.of();
    }
}
