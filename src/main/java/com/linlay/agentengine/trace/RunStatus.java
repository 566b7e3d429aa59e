package com.linlay.agentengine.trace;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromValue(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
