package com.linlay.agentengine.trace;

import com.linlay.agentengine.error.NotFoundException;

public class RunNotFoundException extends NotFoundException {

    public RunNotFoundException(String runId) {
        super("Run", runId);
    }
}
