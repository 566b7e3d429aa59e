package com.linlay.agentengine.model.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.config.ProviderProtocol;
import com.linlay.agentengine.error.ModelException;
import com.linlay.agentengine.model.GenerateRequest;
import com.linlay.agentengine.model.GenerateResponse;
import com.linlay.agentengine.model.Message;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.model.ToolDefinition;
import com.linlay.agentengine.stream.model.StreamChunk;
import com.linlay.agentengine.support.StubHttpServer;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCompatibleModelAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldSendChatCompletionAndParseToolCalls() throws Exception {
        try (StubHttpServer server = StubHttpServer.respond("/v1/chat/completions", 200, "application/json", """
                {
                  "id": "chatcmpl-1",
                  "model": "gpt-4o-mini",
                  "choices": [{
                    "finish_reason": "tool_calls",
                    "message": {
                      "role": "assistant",
                      "content": null,
                      "tool_calls": [{
                        "id": "call_7",
                        "type": "function",
                        "function": {"name": "echo", "arguments": "{\\"text\\":\\"hi\\"}"}
                      }]
                    }
                  }],
                  "usage": {"prompt_tokens": 12, "completion_tokens": 3}
                }
                """)) {
            OpenAiCompatibleModelAdapter adapter = adapter(server.baseUrl());

            GenerateResponse response = adapter.generate(new GenerateRequest(
                    "You are terse.",
                    List.of(
                            Message.user("say hi"),
                            Message.assistant("", List.of(new ToolCall("call_1", "echo", Map.of("text", "a")))),
                            Message.tool("call_1", "a")
                    ),
                    List.of(new ToolDefinition("echo", "Echo text", null)),
                    ModelSettings.of(0.2, 64)
            ));

            assertThat(response.content()).isEmpty();
            assertThat(response.finishReason()).isEqualTo("tool_calls");
            assertThat(response.usage()).isEqualTo(new TokenUsage(12, 3));
            assertThat(response.toolCalls()).containsExactly(new ToolCall("call_7", "echo", Map.of("text", "hi")));
            assertThat(response.metadata()).containsEntry("model", "gpt-4o-mini");

            StubHttpServer.CapturedRequest request = server.takeRequest();
            assertThat(request.authorization()).isEqualTo("Bearer sk-test");
            JsonNode body = objectMapper.readTree(request.body());
            assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
            assertThat(body.path("stream").asBoolean()).isFalse();
            assertThat(body.path("max_tokens").asInt()).isEqualTo(64);
            assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
            assertThat(body.path("messages").get(2).path("tool_calls").get(0).path("function").path("arguments").asText())
                    .isEqualTo("{\"text\":\"a\"}");
            assertThat(body.path("messages").get(3).path("tool_call_id").asText()).isEqualTo("call_1");
            assertThat(body.path("tools").get(0).path("function").path("name").asText()).isEqualTo("echo");
        }
    }

    @Test
    void shouldAssembleStreamedToolCallFragments() throws Exception {
        String sse = """
                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {"choices":[{"delta":{"content":"lo"}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"calculator","arguments":"{\\"operation\\":\\"add\\","}}]}}]}

                data: {"choices":[{"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\"a\\":2,\\"b\\":3}"}}]}}]}

                data: {"choices":[],"usage":{"prompt_tokens":9,"completion_tokens":4}}

                data: [DONE]

                """;
        try (StubHttpServer server = StubHttpServer.respond("/v1/chat/completions", 200, "text/event-stream", sse)) {
            List<StreamChunk> chunks = adapter(server.baseUrl())
                    .generateStream(new GenerateRequest(null, List.of(Message.user("2+3")), List.of(), null))
                    .collectList()
                    .block();

            assertThat(chunks).extracting(StreamChunk::type).containsExactly(
                    StreamChunk.Type.CONTENT,
                    StreamChunk.Type.CONTENT,
                    StreamChunk.Type.TOOL_CALL,
                    StreamChunk.Type.DONE
            );
            assertThat(chunks.get(0).text() + chunks.get(1).text()).isEqualTo("Hello");
            assertThat(chunks.get(2).toolCall().name()).isEqualTo("calculator");
            assertThat(chunks.get(2).toolCall().parameters())
                    .containsEntry("operation", "add")
                    .containsEntry("a", 2)
                    .containsEntry("b", 3);
            assertThat(chunks.get(3).usage()).isEqualTo(new TokenUsage(9, 4));

            JsonNode body = objectMapper.readTree(server.takeRequest().body());
            assertThat(body.path("stream").asBoolean()).isTrue();
            assertThat(body.path("stream_options").path("include_usage").asBoolean()).isTrue();
        }
    }

    @Test
    void shouldWrapHttpErrorsWithProvider() throws Exception {
        try (StubHttpServer server = StubHttpServer.respond("/v1/chat/completions", 401, "application/json",
                "{\"error\":{\"message\":\"bad key\"}}")) {
            OpenAiCompatibleModelAdapter adapter = adapter(server.baseUrl());
            GenerateRequest request = new GenerateRequest(null, List.of(Message.user("x")), List.of(), null);

            assertThatThrownBy(() -> adapter.generate(request))
                    .isInstanceOf(ModelException.class)
                    .hasMessageStartingWith("[openai] HTTP 401")
                    .hasMessageContaining("bad key");

            List<StreamChunk> chunks = adapter.generateStream(request).collectList().block();
            assertThat(chunks).singleElement().satisfies(chunk -> {
                assertThat(chunk.type()).isEqualTo(StreamChunk.Type.ERROR);
                assertThat(chunk.error()).contains("HTTP 401");
            });
        }
    }

    @Test
    void healthCheckShouldReportUnreachableProvider() {
        OpenAiCompatibleModelAdapter adapter = adapter("http://127.0.0.1:1");

        assertThat(adapter.healthCheck().healthy()).isFalse();
        assertThat(adapter.capabilities().contextWindow()).isEqualTo(OpenAiCompatibleModelAdapter.DEFAULT_CONTEXT_WINDOW);
    }

    private OpenAiCompatibleModelAdapter adapter(String baseUrl) {
        AgentProviderProperties.ProviderConfig config = new AgentProviderProperties.ProviderConfig();
        config.setProtocol(ProviderProtocol.OPENAI_COMPATIBLE);
        config.setBaseUrl(baseUrl);
        config.setApiKey("sk-test");
        config.setTimeoutMs(5_000);
        return new OpenAiCompatibleModelAdapter("openai", "gpt-4o-mini", config, WebClient.builder(), objectMapper);
    }
}
