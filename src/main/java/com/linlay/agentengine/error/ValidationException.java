package com.linlay.agentengine.error;

public class ValidationException extends AgentEngineException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
