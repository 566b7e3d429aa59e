package com.linlay.agentengine.memory;

import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.MessageRole;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.support.ScriptedModelAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageWindowingServiceTest {

    private final MessageWindowingService service = new MessageWindowingService();

    @Test
    void shouldReturnInputUnchangedWhenWithinWindow() {
        List<Message> messages = conversation(4);
        ScriptedModelAdapter adapter = new ScriptedModelAdapter();

        assertThat(service.compressMessages(messages, 4, adapter)).isSameAs(messages);
        assertThat(adapter.requests()).isEmpty();
    }

    @Test
    void shouldSummarizeAllButLastChunkAndKeepFailedChunkVerbatim() {
        List<Message> messages = conversation(12);
        ScriptedModelAdapter adapter = new ScriptedModelAdapter()
                .thenReturn(GenerateResponse.text("greeting exchanged", TokenUsage.ZERO))
                .thenThrow(new IllegalStateException("model down"));

        List<Message> compressed = service.compressMessages(messages, 4, adapter);

        assertThat(compressed).hasSize(1 + 4 + 4);
        assertThat(compressed.get(0)).isEqualTo(Message.system("Previous conversation summary: greeting exchanged"));
        assertThat(compressed.subList(1, 5)).isEqualTo(messages.subList(4, 8));
        assertThat(compressed.subList(5, 9)).isEqualTo(messages.subList(8, 12));

        GenerateRequest summaryRequest = adapter.requests().get(0);
        assertThat(summaryRequest.systemPrompt()).startsWith("Summarize the following conversation chunk");
        assertThat(summaryRequest.tools()).isEmpty();
        assertThat(summaryRequest.settings().temperature()).isEqualTo(0.3);
        assertThat(summaryRequest.settings().maxTokens()).isEqualTo(500);
        assertThat(summaryRequest.messages()).hasSize(6);
        assertThat(summaryRequest.messages().get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(summaryRequest.messages().subList(1, 5)).isEqualTo(messages.subList(0, 4));
        assertThat(summaryRequest.messages().get(5))
                .isEqualTo(Message.user("Please provide a summary of the conversation above."));
    }

    @Test
    void shouldKeepShortLastChunk() {
        List<Message> messages = conversation(5);
        ScriptedModelAdapter adapter = new ScriptedModelAdapter()
                .thenReturn(GenerateResponse.text("s1", TokenUsage.ZERO));

        List<Message> compressed = service.compressMessages(messages, 4, adapter);

        assertThat(compressed).hasSize(2);
        assertThat(compressed.get(1)).isEqualTo(messages.get(4));
    }

    private static List<Message> conversation(int size) {
        List<Message> messages = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            messages.add(i % 2 == 0 ? Message.user("question " + i) : Message.assistant("answer " + i, List.of()));
        }
        return messages;
    }
}
