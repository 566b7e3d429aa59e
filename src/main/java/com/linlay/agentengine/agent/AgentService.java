package com.linlay.agentengine.agent;

import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.memory.StructuredMemoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Agent operations that span the repository and the structured memory store.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private final AgentRepository agentRepository;
    private final StructuredMemoryService structuredMemoryService;

    public AgentService(AgentRepository agentRepository, StructuredMemoryService structuredMemoryService) {
        this.agentRepository = agentRepository;
        this.structuredMemoryService = structuredMemoryService;
    }

    public Agent get(String agentId) {
        return agentRepository.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    /**
     * Creates a new agent with the configuration of {@code sourceAgentId}. Prompt history is not
     * carried over; the fork starts at prompt version 1. A failed memory copy is logged and does
     * not fail the fork.
     */
    public Agent fork(String sourceAgentId, String newName, boolean copyMemory) {
        if (!StringUtils.hasText(newName)) {
            throw new ValidationException("name is required and must be a non-empty string");
        }
        Agent source = get(sourceAgentId);
        Agent fork = agentRepository.create(AgentDraft.from(source).name(newName.trim()).build());
        log.info("Forked agent {} into {} ({})", sourceAgentId, fork.id(), fork.name());

        if (copyMemory) {
            try {
                structuredMemoryService.copyMemory(sourceAgentId, fork.id());
            } catch (RuntimeException ex) {
                log.warn("Memory copy from agent {} to {} failed: {}", sourceAgentId, fork.id(), ex.getMessage());
            }
        }
        return fork;
    }
}
