package com.linlay.agentengine.error;

/**
 * Base type of every failure raised by the execution engine. The code is stable and
 * meant for callers that map failures onto their own transport.
 */
public abstract class AgentEngineException extends RuntimeException {

    private final String code;

    protected AgentEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected AgentEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
