package com.linlay.agentengine.stream.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Event delivered to a streaming session consumer.
 */
public record StreamEvent(
        long seq,
        String type,
        long timestamp,
        Map<String, Object> payload
) {

    public static final String RUN_CREATED = "run_created";
    public static final String CONTENT = "content";
    public static final String TOOL_CALL = "tool_call";
    public static final String TOOL_RESULT = "tool_result";
    public static final String DONE = "done";
    public static final String ERROR = "error";
    public static final String END_OF_STREAM = "[DONE]";

    private static final Set<String> RESERVED_KEYS = Set.of("seq", "type", "timestamp");

    public StreamEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (seq < 0) {
            throw new IllegalArgumentException("seq must not be negative");
        }
        if (payload == null) {
            payload = Map.of();
        }
    }

    public boolean isEndOfStream() {
        return END_OF_STREAM.equals(type);
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seq", seq);
        data.put("type", type);
        data.put("timestamp", timestamp);
        if (!payload.isEmpty()) {
            payload.forEach((key, value) -> {
                if (!RESERVED_KEYS.contains(key)) {
                    data.put(key, value);
                }
            });
        }
        return data;
    }
}
