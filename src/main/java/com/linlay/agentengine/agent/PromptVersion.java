package com.linlay.agentengine.agent;

import java.time.Instant;

public record PromptVersion(
        String id,
        String agentId,
        int version,
        String systemPrompt,
        String commitMessage,
        Instant createdAt
) {
}
