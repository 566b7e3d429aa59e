package com.linlay.agentengine.error;

/**
 * Transport or protocol failure of a model provider.
 */
public class ModelException extends AgentEngineException {

    private final String provider;

    public ModelException(String provider, String message) {
        super("MODEL_ERROR", "[" + provider + "] " + message);
        this.provider = provider;
    }

    public ModelException(String provider, String message, Throwable cause) {
        super("MODEL_ERROR", "[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
