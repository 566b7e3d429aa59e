package com.linlay.agentengine.agent;

import java.util.List;
import java.util.Optional;

/**
 * Agent persistence with a version history of system prompts.
 */
public interface AgentRepository {

    /**
     * Stores a new agent and records its prompt as version 1.
     */
    Agent create(AgentDraft draft);

    Optional<Agent> findById(String id);

    List<Agent> findAll(AgentFilter filter);

    /**
     * Applies the non-null fields of {@code draft}. A changed system prompt is recorded as a new
     * prompt version with {@code commitMessage}.
     */
    Agent update(String id, AgentDraft draft, String commitMessage);

    /**
     * Deletes the agent together with its prompt versions and runs.
     */
    void delete(String id);

    boolean exists(String id);

    List<PromptVersion> listPromptVersions(String agentId);

    Optional<PromptVersion> findPromptVersion(String agentId, int version);

    /**
     * Makes the prompt of {@code version} current again. The revert is itself recorded as a
     * new version, so history only grows.
     */
    Agent revertToPromptVersion(String agentId, int version);
}
