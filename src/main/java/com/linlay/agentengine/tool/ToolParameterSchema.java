package com.linlay.agentengine.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-schema style description of a tool's parameters: always an object with named
 * properties and a list of required names.
 */
public record ToolParameterSchema(
        Map<String, Property> properties,
        List<String> required
) {

    public record Property(String type, String description) {
    }

    public ToolParameterSchema {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        required = required == null ? List.of() : List.copyOf(required);
    }

    public static ToolParameterSchema empty() {
        return new ToolParameterSchema(Map.of(), List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        properties.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    Map<String, Object> property = new LinkedHashMap<>();
                    property.put("type", entry.getValue().type());
                    if (entry.getValue().description() != null) {
                        property.put("description", entry.getValue().description());
                    }
                    props.put(entry.getKey(), property);
                });
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    public static final class Builder {
        private final Map<String, Property> properties = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder() {
        }

        public Builder required(String name, String type, String description) {
            properties.put(name, new Property(type, description));
            required.add(name);
            return this;
        }

        public Builder optional(String name, String type, String description) {
            properties.put(name, new Property(type, description));
            return this;
        }

        public ToolParameterSchema build() {
            return new ToolParameterSchema(properties, required);
        }
    }
}
