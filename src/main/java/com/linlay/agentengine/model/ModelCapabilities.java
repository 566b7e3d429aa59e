package com.linlay.agentengine.model;

public record ModelCapabilities(
        int contextWindow,
        boolean supportsTools,
        boolean supportsStreaming,
        boolean supportsVision
) {
}
