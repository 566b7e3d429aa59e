package com.linlay.agentengine.error;

public class NotFoundException extends AgentEngineException {

    private final String resource;
    private final String resourceId;

    public NotFoundException(String resource, String resourceId) {
        super("NOT_FOUND", resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public String resource() {
        return resource;
    }

    public String resourceId() {
        return resourceId;
    }
}
