package com.linlay.agentengine.stream.adapter.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.stream.model.LlmDelta;
import com.linlay.agentengine.stream.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class OpenAiSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSseDeltaParser.class);

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public static boolean isDoneMarker(String rawChunk) {
        if (rawChunk == null) {
            return false;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        return "[DONE]".equals(payload);
    }

    public LlmDelta parseOrNull(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode errorNode = root.get("error");
            if (errorNode != null && !errorNode.isNull()) {
                throw new IllegalStateException(errorNode.path("message").asText(errorNode.toString()));
            }
            Map<String, Object> usage = parseUsage(root.get("usage"));
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                if (usage != null) {
                    return new LlmDelta(null, null, null, usage);
                }
                return null;
            }

            JsonNode firstChoice = choices.get(0);
            JsonNode deltaNode = firstChoice.path("delta");
            String content = optionalText(deltaNode.get("content"));
            String finishReason = optionalText(firstChoice.get("finish_reason"));

            List<ToolCallDelta> toolCalls = new ArrayList<>();
            JsonNode toolCallsNode = deltaNode.path("tool_calls");
            if (toolCallsNode.isArray()) {
                for (JsonNode toolCallNode : toolCallsNode) {
                    String id = optionalText(toolCallNode.get("id"));
                    Integer index = optionalInt(toolCallNode.get("index"));
                    JsonNode functionNode = toolCallNode.path("function");
                    String name = optionalText(functionNode.get("name"));
                    String arguments = optionalText(functionNode.get("arguments"));
                    if (!hasText(id) && index == null && !hasText(name) && !hasText(arguments)) {
                        continue;
                    }
                    toolCalls.add(new ToolCallDelta(id, index, name, arguments));
                }
            }

            boolean empty = !hasText(content)
                    && toolCalls.isEmpty()
                    && !hasText(finishReason)
                    && usage == null;
            if (empty) {
                return null;
            }
            return new LlmDelta(
                    content,
                    toolCalls.isEmpty() ? null : toolCalls,
                    finishReason,
                    usage
            );
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("Failed to parse OpenAI SSE chunk: {}", rawChunk, ex);
            return null;
        }
    }

    private Map<String, Object> parseUsage(JsonNode usageNode) {
        if (usageNode == null || usageNode.isNull() || usageNode.isMissingNode() || !usageNode.isObject()) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        usageNode.fields().forEachRemaining(entry -> {
            JsonNode valueNode = entry.getValue();
            if (valueNode.isIntegralNumber()) {
                usage.put(entry.getKey(), valueNode.asLong());
            } else if (valueNode.isNumber()) {
                usage.put(entry.getKey(), valueNode.doubleValue());
            }
        });
        return usage.isEmpty() ? null : usage;
    }

    private String normalizePayload(String rawChunk) {
        if (!hasText(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!hasText(payload) || "[DONE]".equals(payload) || payload.startsWith(":")) {
            return null;
        }
        return payload;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private Integer optionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
