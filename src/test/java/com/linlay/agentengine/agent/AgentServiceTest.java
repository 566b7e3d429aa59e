package com.linlay.agentengine.agent;

import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.memory.StructuredMemoryService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentServiceTest {

    private final AgentRepository repository = mock(AgentRepository.class);
    private final StructuredMemoryService memoryService = mock(StructuredMemoryService.class);
    private final AgentService service = new AgentService(repository, memoryService);

    private final Agent source = new Agent("src", "Source", "desc", "prompt", 4, "ollama:llama3.1",
            List.of("echo"), List.of("tag"), null, 8, true, Instant.EPOCH, Instant.EPOCH);

    @Test
    void forkShouldCopyConfigurationAndMemory() {
        when(repository.findById("src")).thenReturn(Optional.of(source));
        when(repository.create(any())).thenAnswer(invocation -> {
            AgentDraft draft = invocation.getArgument(0);
            return new Agent("fork", draft.name(), draft.description(), draft.systemPrompt(), 1, draft.defaultModel(),
                    draft.allowedTools(), draft.tags(), draft.settings(), draft.messageWindowSize(),
                    draft.structuredMemoryEnabled(), Instant.EPOCH, Instant.EPOCH);
        });

        Agent fork = service.fork("src", "  Copy  ", true);

        assertThat(fork.name()).isEqualTo("Copy");
        assertThat(fork.systemPrompt()).isEqualTo("prompt");
        assertThat(fork.allowedTools()).containsExactly("echo");
        assertThat(fork.messageWindowSize()).isEqualTo(8);
        verify(memoryService).copyMemory("src", "fork");
    }

    @Test
    void forkShouldSurviveMemoryCopyFailure() {
        when(repository.findById("src")).thenReturn(Optional.of(source));
        when(repository.create(any())).thenReturn(source);
        when(memoryService.copyMemory(anyString(), anyString())).thenThrow(new IllegalStateException("disk full"));

        assertThat(service.fork("src", "Copy", true)).isSameAs(source);
    }

    @Test
    void forkShouldValidateNameAndSource() {
        assertThatThrownBy(() -> service.fork("src", " ", false)).isInstanceOf(ValidationException.class);
        when(repository.findById("missing")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.fork("missing", "Copy", false)).isInstanceOf(AgentNotFoundException.class);
        verify(repository, never()).create(any());
    }
}
