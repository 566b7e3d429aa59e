package com.linlay.agentengine.stream.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.stream.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Merges streamed tool-call fragments by index and resolves them into complete calls once the
 * stream ends. Not thread-safe: one instance per stream.
 */
public class ToolCallAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallAccumulator.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Map<Integer, PendingCall> pendingByIndex = new LinkedHashMap<>();
    private Integer lastIndex;

    public ToolCallAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public void accept(ToolCallDelta delta) {
        if (delta == null) {
            return;
        }
        append(resolveIndex(delta.index(), delta.id()), delta.id(), delta.name(), delta.arguments());
    }

    public void append(int index, String id, String name, String argumentsFragment) {
        PendingCall pending = pendingByIndex.computeIfAbsent(index, ignored -> new PendingCall());
        if (StringUtils.hasText(id)) {
            pending.id = id;
        }
        if (StringUtils.hasText(name)) {
            pending.name = name;
        }
        if (argumentsFragment != null) {
            pending.arguments.append(argumentsFragment);
        }
        lastIndex = index;
    }

    public boolean isEmpty() {
        return pendingByIndex.isEmpty();
    }

    /**
     * Resolves all pending calls in index order and resets the accumulator. Calls without a name
     * are dropped; unparsable arguments resolve to empty parameters.
     */
    public List<ToolCall> drain() {
        List<ToolCall> calls = new ArrayList<>();
        for (Map.Entry<Integer, PendingCall> entry : pendingByIndex.entrySet()) {
            PendingCall pending = entry.getValue();
            if (!StringUtils.hasText(pending.name)) {
                log.warn("Dropping streamed tool call at index {} without a name", entry.getKey());
                continue;
            }
            String id = StringUtils.hasText(pending.id) ? pending.id : "call_" + UUID.randomUUID();
            calls.add(new ToolCall(id, pending.name, parseArguments(pending.name, pending.arguments.toString())));
        }
        pendingByIndex.clear();
        lastIndex = null;
        return calls;
    }

    private int resolveIndex(Integer index, String id) {
        if (index != null) {
            return index;
        }
        if (StringUtils.hasText(id)) {
            for (Map.Entry<Integer, PendingCall> entry : pendingByIndex.entrySet()) {
                if (id.equals(entry.getValue().id)) {
                    return entry.getKey();
                }
            }
            return pendingByIndex.size();
        }
        return lastIndex == null ? 0 : lastIndex;
    }

    private Map<String, Object> parseArguments(String toolName, String raw) {
        if (!StringUtils.hasText(raw)) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, MAP_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (Exception ex) {
            log.warn("Unparsable arguments for tool call '{}', using empty parameters: {}", toolName, raw);
            return Map.of();
        }
    }

    private static final class PendingCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
