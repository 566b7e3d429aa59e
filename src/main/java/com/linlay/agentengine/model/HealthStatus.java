package com.linlay.agentengine.model;

public record HealthStatus(boolean healthy, long latencyMs, String message) {

    public static HealthStatus up(long latencyMs) {
        return new HealthStatus(true, latencyMs, "ok");
    }

    public static HealthStatus down(long latencyMs, String message) {
        return new HealthStatus(false, latencyMs, message);
    }
}
