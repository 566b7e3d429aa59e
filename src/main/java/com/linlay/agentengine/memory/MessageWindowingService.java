package com.linlay.agentengine.memory;

import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelAdapter;
import com.linlay.agentengine.model.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounds the conversation buffer by replacing older chunks of {@code windowSize} messages with
 * one summary system message each. The newest chunk is always kept verbatim.
 */
@Service
public class MessageWindowingService {

    private static final Logger log = LoggerFactory.getLogger(MessageWindowingService.class);

    static final String SUMMARY_PREFIX = "Previous conversation summary: ";
    private static final String SUMMARIZATION_PROMPT = "Summarize the following conversation chunk, "
            + "preserving key information, decisions, and context that would be important for continuing "
            + "the conversation. Be concise but comprehensive.";
    private static final String SUMMARIZER_ROLE = "You are a conversation summarizer. "
            + "Create concise summaries that preserve important context.";
    private static final String SUMMARY_INSTRUCTION = "Please provide a summary of the conversation above.";
    private static final ModelSettings SUMMARY_SETTINGS = ModelSettings.of(0.3, 500);

    public List<Message> compressMessages(List<Message> messages, int windowSize, ModelAdapter adapter) {
        if (messages == null || windowSize <= 0 || messages.size() <= windowSize) {
            return messages;
        }

        List<List<Message>> chunks = new ArrayList<>();
        for (int start = 0; start < messages.size(); start += windowSize) {
            chunks.add(messages.subList(start, Math.min(start + windowSize, messages.size())));
        }

        List<Message> compressed = new ArrayList<>();
        for (int i = 0; i < chunks.size() - 1; i++) {
            List<Message> chunk = chunks.get(i);
            try {
                String summary = summarizeChunk(chunk, adapter);
                compressed.add(Message.system(SUMMARY_PREFIX + summary));
            } catch (RuntimeException ex) {
                // keep the chunk as is; a missing summary must not fail the run
                log.warn("Failed to summarize chunk {} of {} messages, keeping it verbatim: {}",
                        i, chunk.size(), ex.getMessage());
                compressed.addAll(chunk);
            }
        }
        compressed.addAll(chunks.get(chunks.size() - 1));
        log.debug("Compressed {} messages into {} (window={})", messages.size(), compressed.size(), windowSize);
        return compressed;
    }

    private String summarizeChunk(List<Message> chunk, ModelAdapter adapter) {
        List<Message> request = new ArrayList<>(chunk.size() + 2);
        request.add(Message.system(SUMMARIZER_ROLE));
        request.addAll(chunk);
        request.add(Message.user(SUMMARY_INSTRUCTION));
        return adapter.generate(new GenerateRequest(SUMMARIZATION_PROMPT, request, List.of(), SUMMARY_SETTINGS))
                .content();
    }
}
