package com.linlay.agentengine.model;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
