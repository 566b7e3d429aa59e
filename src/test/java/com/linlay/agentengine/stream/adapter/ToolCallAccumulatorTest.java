package com.linlay.agentengine.stream.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentengine.model.ToolCall;
import com.linlay.agentengine.stream.model.ToolCallDelta;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallAccumulatorTest {

    private final ToolCallAccumulator accumulator = new ToolCallAccumulator(new ObjectMapper());

    @Test
    void shouldMergeFragmentsByIndex() {
        accumulator.accept(new ToolCallDelta("call_a", 0, "echo", "{\"te"));
        accumulator.accept(new ToolCallDelta("call_b", 1, "calculator", "{\"operation\":\"add\","));
        accumulator.accept(new ToolCallDelta(null, 0, null, "xt\":\"hi\"}"));
        accumulator.accept(new ToolCallDelta(null, 1, null, "\"a\":1,\"b\":2}"));

        List<ToolCall> calls = accumulator.drain();

        assertThat(calls).hasSize(2);
        assertThat(calls.get(0)).isEqualTo(new ToolCall("call_a", "echo", Map.of("text", "hi")));
        assertThat(calls.get(1).parameters()).containsEntry("operation", "add").containsEntry("a", 1).containsEntry("b", 2);
        assertThat(accumulator.isEmpty()).isTrue();
    }

    @Test
    void shouldAppendToLastCallWhenIndexAndIdAreMissing() {
        accumulator.accept(new ToolCallDelta("call_1", null, "echo", "{\"text\":"));
        accumulator.accept(new ToolCallDelta(null, null, null, "\"x\"}"));

        assertThat(accumulator.drain()).containsExactly(new ToolCall("call_1", "echo", Map.of("text", "x")));
    }

    @Test
    void unparsableArgumentsShouldResolveToEmptyParameters() {
        accumulator.accept(new ToolCallDelta("call_1", 0, "echo", "{\"text\": \"unterminated"));

        List<ToolCall> calls = accumulator.drain();

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).parameters()).isEmpty();
    }

    @Test
    void shouldDropNamelessCallsAndGenerateMissingIds() {
        accumulator.append(0, null, null, "{}");
        accumulator.append(1, null, "echo", "");

        List<ToolCall> calls = accumulator.drain();

        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).name()).isEqualTo("echo");
        assertThat(calls.get(0).id()).startsWith("call_");
        assertThat(calls.get(0).parameters()).isEmpty();
    }
}
