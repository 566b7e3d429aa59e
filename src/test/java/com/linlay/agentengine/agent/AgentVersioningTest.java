package com.linlay.agentengine.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AgentVersioningTest {

    @Test
    void memoryHashShouldBeFirstSixteenHexCharsOfSha256() {
        // sha256("hello world") = b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9
        assertThat(AgentVersioning.memoryHash("hello ", "world")).isEqualTo("b94d27b9934d3e08");
        assertThat(AgentVersioning.memoryHash(null, null)).hasSize(16);
    }

    @Test
    void shouldComposeAndParseVersion() {
        String version = AgentVersioning.version(3, 12, "b94d27b9934d3e08");

        assertThat(version).isEqualTo("3.12.b94d27b9934d3e08");
        assertThat(AgentVersioning.parse(version))
                .contains(new AgentVersioning.ParsedVersion(3, 12, "b94d27b9934d3e08"));
    }

    @Test
    void shouldRejectMalformedVersions() {
        assertThat(AgentVersioning.parse("3.12")).isEmpty();
        assertThat(AgentVersioning.parse("x.1.abc")).isEmpty();
        assertThat(AgentVersioning.parse("1.2.3.4")).isEmpty();
        assertThat(AgentVersioning.parse(null)).isEmpty();
    }
}
