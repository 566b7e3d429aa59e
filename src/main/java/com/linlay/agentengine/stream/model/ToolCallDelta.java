package com.linlay.agentengine.stream.model;

public record ToolCallDelta(
        String id,
        Integer index,
        String name,
        String arguments
) {
}
