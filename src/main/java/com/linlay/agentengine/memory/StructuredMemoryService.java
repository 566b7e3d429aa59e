package com.linlay.agentengine.memory;

import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelAdapter;
import com.linlay.agentengine.model.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-agent markdown memory holding the key facts of past conversations and the current
 * topic. Rewritten after each successful run of an agent that has it enabled.
 */
@Service
public class StructuredMemoryService {

    private static final Logger log = LoggerFactory.getLogger(StructuredMemoryService.class);

    private static final String EXTRACTION_PROMPT = """
            Analyze the conversation and extract:
            1. KEY CONVO DATA: Important facts, decisions, user preferences, key information that should be remembered
            2. CURRENT TOPIC: What is the current focus/topic of the conversation?

            Format your response as:
            KEY CONVO DATA: [your extraction]
            CURRENT TOPIC: [your extraction]""";
    private static final String ANALYZER_ROLE = "You are a conversation analyzer. "
            + "Extract key information and current topics from conversations.";
    private static final String EXTRACTION_INSTRUCTION =
            "Extract the key conversation data and current topic from the conversation above.";
    private static final ModelSettings EXTRACTION_SETTINGS = ModelSettings.of(0.3, 1000);

    private static final Pattern KEY_DATA = Pattern.compile("KEY CONVO DATA:\\s*(.+?)(?=CURRENT TOPIC:|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern CURRENT_TOPIC = Pattern.compile("CURRENT TOPIC:\\s*(.+?)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final String NO_KEY_DATA = "No key data extracted yet.";
    static final String NO_TOPIC = "No specific topic identified.";

    private final StructuredMemoryStore store;
    private final StructuredMemoryProperties properties;
    private final Clock clock;

    public StructuredMemoryService(StructuredMemoryStore store, StructuredMemoryProperties properties) {
        this(store, properties, Clock.systemUTC());
    }

    StructuredMemoryService(StructuredMemoryStore store, StructuredMemoryProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<String> readMemory(String agentId) {
        return store.read(agentId).filter(StringUtils::hasText);
    }

    public void writeMemory(String agentId, String content) {
        store.write(agentId, content);
    }

    /**
     * Copies the memory document of one agent to another.
     *
     * @return {@code false} when the source agent has no memory
     */
    public boolean copyMemory(String sourceAgentId, String targetAgentId) {
        Optional<String> memory = store.read(sourceAgentId);
        if (memory.isEmpty()) {
            return false;
        }
        store.write(targetAgentId, memory.get());
        log.info("Copied structured memory from agent {} to agent {}", sourceAgentId, targetAgentId);
        return true;
    }

    /**
     * Extracts key data and the current topic from the tail of the conversation and rewrites the
     * agent's memory document. Failures are logged and never reach the caller.
     */
    public void updateMemory(String agentId, String runId, List<Message> messages, ModelAdapter adapter) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        try {
            int window = Math.max(1, properties.getExtractionWindow());
            List<Message> recent = messages.subList(Math.max(0, messages.size() - window), messages.size());

            List<Message> request = new ArrayList<>(recent.size() + 2);
            request.add(Message.system(ANALYZER_ROLE));
            request.addAll(recent);
            request.add(Message.user(EXTRACTION_INSTRUCTION));
            String extraction = adapter.generate(
                    new GenerateRequest(EXTRACTION_PROMPT, request, List.of(), EXTRACTION_SETTINGS)).content();

            store.write(agentId, render(extraction, runId, clock.instant()));
            log.debug("Updated structured memory for agent {} after run {}", agentId, runId);
        } catch (RuntimeException ex) {
            log.warn("Structured memory update failed for agent {} run {}: {}", agentId, runId, ex.getMessage());
        }
    }

    static String render(String extraction, String runId, Instant updatedAt) {
        String keyData = firstGroup(KEY_DATA, extraction).orElse(NO_KEY_DATA);
        String topic = firstGroup(CURRENT_TOPIC, extraction).orElse(NO_TOPIC);
        return "# Conversation Memory\n\n"
                + "## KEY CONVO DATA\n" + keyData + "\n\n"
                + "## CURRENT TOPIC\n" + topic + "\n\n"
                + "---\n"
                + "Last updated: " + updatedAt + "\n"
                + "Run ID: " + runId + "\n";
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
