package com.linlay.agentengine.trace.pricing;

public record RunCost(
        String runId,
        String modelId,
        String provider,
        long inputTokens,
        long outputTokens,
        double inputCost,
        double outputCost
) {

    public double totalCost() {
        return inputCost + outputCost;
    }
}
