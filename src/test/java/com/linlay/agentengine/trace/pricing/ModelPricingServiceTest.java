package com.linlay.agentengine.trace.pricing;

import com.linlay.agentengine.agent.Agent;
import com.linlay.agentengine.agent.AgentDraft;
import com.linlay.agentengine.agent.JdbcAgentRepository;
import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.support.TestDatabase;
import com.linlay.agentengine.trace.JdbcTraceStore;
import com.linlay.agentengine.trace.Run;
import com.linlay.agentengine.trace.RunNotFoundException;
import com.linlay.agentengine.trace.Turn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelPricingServiceTest {

    private final TestDatabase database = new TestDatabase();
    private final JdbcTraceStore traceStore =
            new JdbcTraceStore(database.jdbc(), database.transactionTemplate(), database.json());
    private final AtomicInteger fetches = new AtomicInteger();
    private Agent agent;

    @BeforeEach
    void setUp() {
        agent = new JdbcAgentRepository(database.jdbc(), database.transactionTemplate(), database.json())
                .create(AgentDraft.builder()
                        .name("Priced")
                        .systemPrompt("p")
                        .defaultModel("openai:gpt-4o-mini")
                        .build());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void shouldComputeCostPerThousandTokens() {
        ModelPricingService service = service(fixedSource("gpt-4o-mini", "openai", 0.15, 0.6));
        Run run = runWithUsage("openai:gpt-4o-mini", new TokenUsage(2000, 500));

        RunCost cost = service.calculateRunCost(run.id()).orElseThrow();

        assertThat(cost.modelId()).isEqualTo("gpt-4o-mini");
        assertThat(cost.provider()).isEqualTo("openai");
        assertThat(cost.inputTokens()).isEqualTo(2000);
        assertThat(cost.outputTokens()).isEqualTo(500);
        assertThat(cost.inputCost()).isCloseTo(0.3, within(1e-9));
        assertThat(cost.outputCost()).isCloseTo(0.3, within(1e-9));
        assertThat(cost.totalCost()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void unknownPricingShouldYieldEmptyCostRatherThanZero() {
        ModelPricingService service = service((modelId, provider) -> Optional.empty());
        Run run = runWithUsage("ollama:llama3.1", new TokenUsage(100, 100));

        assertThat(service.calculateRunCost(run.id())).isEmpty();
    }

    @Test
    void fetchedPricingShouldBeCachedUntilForcedUpdate() {
        ModelPricingService service = service(fixedSource("gpt-4o-mini", "openai", 1.0, 2.0));

        assertThat(service.getModelPricing("gpt-4o-mini", "openai", false)).isPresent();
        assertThat(service.getModelPricing("gpt-4o-mini", "openai", false)).isPresent();
        assertThat(fetches.get()).isEqualTo(1);

        ModelPricing refreshed = service.getModelPricing("gpt-4o-mini", "openai", true).orElseThrow();
        assertThat(fetches.get()).isEqualTo(2);
        assertThat(refreshed.inputPricePer1k()).isEqualTo(1.0);
        Integer rows = database.jdbc().getJdbcTemplate()
                .queryForObject("SELECT COUNT(*) FROM model_pricing", Integer.class);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void sourcesShouldBeConsultedInOrder() {
        ModelPricingService service = service(
                (modelId, provider) -> Optional.empty(),
                fixedSource("gpt-4o-mini", "openai", 3.0, 4.0));

        assertThat(service.getModelPricing("gpt-4o-mini", "openai", false))
                .get()
                .extracting(ModelPricing::outputPricePer1k)
                .isEqualTo(4.0);
    }

    @Test
    void missingRunShouldFail() {
        ModelPricingService service = service((modelId, provider) -> Optional.empty());

        assertThatThrownBy(() -> service.calculateRunCost("missing")).isInstanceOf(RunNotFoundException.class);
    }

    private ModelPricingService service(ModelPricingSource... sources) {
        AgentProviderProperties properties = new AgentProviderProperties();
        properties.setDefaultProvider("ollama");
        return new ModelPricingService(database.jdbc(), traceStore, List.of(sources), properties);
    }

    private ModelPricingSource fixedSource(String model, String provider, double input, double output) {
        return (modelId, providerKey) -> {
            if (!model.equals(modelId) || !provider.equals(providerKey)) {
                return Optional.empty();
            }
            fetches.incrementAndGet();
            return Optional.of(new ModelPricing(modelId, providerKey, input, output, Instant.now()));
        };
    }

    private Run runWithUsage(String modelUsed, TokenUsage usage) {
        Run run = traceStore.createRun(agent.id(), modelUsed, null, 1);
        traceStore.appendTurn(run.id(), Turn.draft(1, "q", "a", List.of(), usage, Instant.now(), 1));
        return traceStore.getRun(run.id()).orElseThrow();
    }
}
