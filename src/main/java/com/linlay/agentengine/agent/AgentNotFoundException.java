package com.linlay.agentengine.agent;

import com.linlay.agentengine.error.NotFoundException;

public class AgentNotFoundException extends NotFoundException {

    public AgentNotFoundException(String agentId) {
        super("Agent", agentId);
    }
}
