package com.linlay.agentengine.config;

public enum ProviderProtocol {
    OPENAI_COMPATIBLE,
    OLLAMA,
    ANTHROPIC
}
