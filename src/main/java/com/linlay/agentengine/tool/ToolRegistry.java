package com.linlay.agentengine.tool;

import com.linlay.agentengine.error.ToolExecutionException;
import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named tool implementations plus the dispatcher that validates and times every call.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, BaseTool> toolsByName = new ConcurrentHashMap<>();

    public ToolRegistry(List<BaseTool> tools) {
        if (tools != null) {
            tools.forEach(this::register);
        }
    }

    public void register(BaseTool tool) {
        Objects.requireNonNull(tool, "tool cannot be null");
        String name = normalizeName(tool.name());
        if (name.isEmpty()) {
            throw new ValidationException("Tool name must not be blank");
        }
        BaseTool existing = toolsByName.putIfAbsent(name, tool);
        if (existing != null) {
            throw new ValidationException("Tool already registered: " + name);
        }
        log.debug("Registered tool '{}'", name);
    }

    public BaseTool get(String name) {
        return toolsByName.get(normalizeName(name));
    }

    public List<BaseTool> listAll() {
        return toolsByName.values().stream()
                .sorted(Comparator.comparing(tool -> normalizeName(tool.name())))
                .toList();
    }

    /**
     * Resolves names to live tools in the given order; unknown names are skipped.
     */
    public List<BaseTool> listByNames(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        List<BaseTool> tools = new ArrayList<>();
        for (String name : names) {
            BaseTool tool = get(name);
            if (tool != null && !tools.contains(tool)) {
                tools.add(tool);
            }
        }
        return List.copyOf(tools);
    }

    public List<ToolDefinition> toDefinitions(List<BaseTool> tools) {
        return tools.stream()
                .map(tool -> new ToolDefinition(tool.name(), tool.description(), tool.parametersSchema().toJsonSchema()))
                .toList();
    }

    /**
     * Dispatches one call. Never throws for tool-level problems: unknown tools, missing
     * parameters and tool exceptions all come back as failed results.
     */
    public ToolResult execute(String name, Map<String, Object> parameters) {
        long start = System.nanoTime();
        BaseTool tool = get(name);
        if (tool == null) {
            String message = "Tool " + name + " not found";
            return ToolResult.failure(message, message).withExecutionTime(elapsedMs(start));
        }
        Map<String, Object> args = parameters == null ? Map.of() : parameters;
        List<String> missing = missingRequired(tool, args);
        if (!missing.isEmpty()) {
            String message = "Missing required parameters: " + String.join(", ", missing);
            return ToolResult.failure(message).withExecutionTime(elapsedMs(start));
        }
        try {
            ToolResult result = tool.execute(args);
            if (result == null) {
                result = ToolResult.success("");
            }
            return result.withExecutionTime(elapsedMs(start));
        } catch (RuntimeException ex) {
            ToolExecutionException failure = new ToolExecutionException(tool.name(), describe(ex), ex);
            log.warn("{}", failure.getMessage(), ex);
            return ToolResult.failure(failure.getMessage()).withExecutionTime(elapsedMs(start));
        }
    }

    public static String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    private List<String> missingRequired(BaseTool tool, Map<String, Object> args) {
        List<String> missing = new ArrayList<>();
        for (String required : tool.parametersSchema().required()) {
            Object value = args.get(required);
            if (value == null || (value instanceof String text && text.isBlank())) {
                missing.add(required);
            }
        }
        return missing;
    }

    private String describe(Throwable ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
