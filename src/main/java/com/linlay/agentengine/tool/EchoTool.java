package com.linlay.agentengine.tool;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class EchoTool implements BaseTool {

    @Override
    public String name() {
        return "echo";
    }

    @Override
    public String description() {
        return "Returns the given text unchanged.";
    }

    @Override
    public ToolParameterSchema parametersSchema() {
        return ToolParameterSchema.builder()
                .required("text", "string", "Text to echo back")
                .build();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters) {
        String text = String.valueOf(parameters.get("text"));
        return ToolResult.success(text, Map.of("text", text));
    }
}
