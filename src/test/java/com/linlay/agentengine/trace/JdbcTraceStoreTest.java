package com.linlay.agentengine.trace;

import com.linlay.agentengine.agent.Agent;
import com.linlay.agentengine.agent.AgentDraft;
import com.linlay.agentengine.agent.JdbcAgentRepository;
import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.support.TestDatabase;
import com.linlay.agentengine.tool.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcTraceStoreTest {

    private final TestDatabase database = new TestDatabase();
    private final JdbcTraceStore store =
            new JdbcTraceStore(database.jdbc(), database.transactionTemplate(), database.json());
    private final JdbcAgentRepository agents =
            new JdbcAgentRepository(database.jdbc(), database.transactionTemplate(), database.json());

    private Agent agent;

    @BeforeEach
    void setUp() {
        agent = agents.create(AgentDraft.builder()
                .name("Tracer")
                .systemPrompt("trace me")
                .defaultModel("ollama:llama3.1")
                .build());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createRunShouldStartRunningWithZeroTotals() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", ModelSettings.of(0.5, 100), 1);

        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.usage()).isEqualTo(TokenUsage.ZERO);
        assertThat(run.totalToolCalls()).isZero();
        assertThat(run.modelSettings()).isEqualTo(ModelSettings.of(0.5, 100));
        assertThat(run.version().promptVersion()).isEqualTo(1);
        assertThat(run.turns()).isEmpty();
    }

    @Test
    void appendTurnShouldAggregateTokensAndToolCalls() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        ToolExecution echo = ToolExecution.draft("call_1", 1, "echo", Map.of("text", "hi"), ToolResult.success("hi"));

        store.appendTurn(run.id(), Turn.draft(1, "hello", "", List.of(echo), new TokenUsage(10, 5), Instant.now(), 12));
        store.appendTurn(run.id(), Turn.draft(2, "[Tool results]", "done", List.of(), new TokenUsage(20, 7), Instant.now(), 8));

        Run reloaded = store.getRun(run.id()).orElseThrow();
        assertThat(reloaded.usage()).isEqualTo(new TokenUsage(30, 12));
        assertThat(reloaded.usage().totalTokens()).isEqualTo(42);
        assertThat(reloaded.totalToolCalls()).isEqualTo(1);
        assertThat(reloaded.turns()).extracting(Turn::turnNumber).containsExactly(1, 2);
        assertThat(reloaded.turns().get(0).toolExecutions()).singleElement()
                .satisfies(execution -> {
                    assertThat(execution.id()).isEqualTo("call_1");
                    assertThat(execution.parameters()).containsEntry("text", "hi");
                    assertThat(execution.result().output()).isEqualTo("hi");
                });
    }

    @Test
    void appendTurnShouldRejectGapsAndDuplicates() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        store.appendTurn(run.id(), Turn.draft(1, "hello", "hi", List.of(), TokenUsage.ZERO, Instant.now(), 1));

        assertThatThrownBy(() -> store.appendTurn(run.id(),
                Turn.draft(3, "x", "y", List.of(), TokenUsage.ZERO, Instant.now(), 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> store.appendTurn(run.id(),
                Turn.draft(1, "x", "y", List.of(), TokenUsage.ZERO, Instant.now(), 1)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void executionLoggedBeforeTurnShouldBeReconciledIntoFinalTurn() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);

        ToolExecution first = store.logToolExecution(run.id(),
                ToolExecution.draft("call_a", 1, "echo", Map.of("text", "a"), ToolResult.success("a")));
        ToolExecution second = store.logToolExecution(run.id(),
                ToolExecution.draft("call_b", 1, "calculator", Map.of(), ToolResult.failure("Missing required parameters: a")));

        Run midway = store.getRun(run.id()).orElseThrow();
        assertThat(midway.turns()).singleElement().satisfies(turn -> {
            assertThat(turn.state()).isEqualTo(TurnState.PROVISIONAL);
            assertThat(turn.toolExecutions()).hasSize(2);
        });
        assertThat(midway.finalizedTurns()).isEmpty();
        assertThat(midway.lastFinalizedTurnNumber()).isZero();

        Turn finalized = store.appendTurn(run.id(),
                Turn.draft(1, "hello", "", List.of(first, second), new TokenUsage(3, 4), Instant.now(), 5));

        assertThat(finalized.state()).isEqualTo(TurnState.FINALIZED);
        assertThat(finalized.id()).isEqualTo(first.turnId());
        assertThat(finalized.toolExecutions()).extracting(ToolExecution::id).containsExactly("call_a", "call_b");

        Run reloaded = store.getRun(run.id()).orElseThrow();
        assertThat(reloaded.turns()).hasSize(1);
        assertThat(reloaded.totalToolCalls()).isEqualTo(2);
        assertThat(reloaded.turns().get(0).userMessage()).isEqualTo("hello");
    }

    @Test
    void duplicateExecutionIdShouldGetFreshId() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        store.logToolExecution(run.id(), ToolExecution.draft("call_0", 1, "echo", Map.of(), ToolResult.success("1")));

        ToolExecution again = store.logToolExecution(run.id(),
                ToolExecution.draft("call_0", 2, "echo", Map.of(), ToolResult.success("2")));

        assertThat(again.id()).isNotEqualTo("call_0");
        assertThat(again.turnNumber()).isEqualTo(2);
    }

    @Test
    void statusShouldBeTerminalUntilReopened() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);

        store.updateRunStatus(run.id(), RunStatus.ERROR, "boom", 40L);

        Run failed = store.getRun(run.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(RunStatus.ERROR);
        assertThat(failed.error()).isEqualTo("boom");
        assertThat(failed.completedAt()).isNotNull();
        assertThat(failed.totalDurationMs()).isEqualTo(40L);
        assertThatThrownBy(() -> store.updateRunStatus(run.id(), RunStatus.COMPLETED, null))
                .isInstanceOf(ValidationException.class);

        store.reopenRun(run.id());
        assertThat(store.getRun(run.id()).orElseThrow().status()).isEqualTo(RunStatus.RUNNING);
        assertThatThrownBy(() -> store.reopenRun(run.id())).isInstanceOf(ValidationException.class);

        store.updateRunStatus(run.id(), RunStatus.COMPLETED, null, 10L);
        Run completed = store.getRun(run.id()).orElseThrow();
        assertThat(completed.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(completed.error()).isNull();
        assertThat(completed.totalDurationMs()).isEqualTo(50L);
    }

    @Test
    void failingRunShouldCloseOpenPlaceholderTurn() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        store.appendTurn(run.id(), Turn.draft(1, "first", "", List.of(), TokenUsage.ZERO, Instant.now(), 5));
        store.logToolExecution(run.id(),
                ToolExecution.draft("call_a", 2, "echo", Map.of("text", "stale"), ToolResult.success("stale")));

        store.updateRunStatus(run.id(), RunStatus.ERROR, "Tool calculator is not allowed", 30L);

        Run failed = store.getRun(run.id()).orElseThrow();
        assertThat(failed.turns()).extracting(Turn::state).containsOnly(TurnState.FINALIZED);
        assertThat(failed.lastFinalizedTurnNumber()).isEqualTo(2);
        assertThat(failed.totalToolCalls()).isEqualTo(1);

        store.reopenRun(run.id());
        assertThatThrownBy(() -> store.appendTurn(run.id(),
                Turn.draft(2, "second", "fresh answer", List.of(), TokenUsage.ZERO, Instant.now(), 5)))
                .isInstanceOf(ValidationException.class);
        store.appendTurn(run.id(), Turn.draft(3, "second", "fresh answer", List.of(), TokenUsage.ZERO, Instant.now(), 5));

        Run continued = store.getRun(run.id()).orElseThrow();
        assertThat(continued.turns()).extracting(Turn::turnNumber).containsExactly(1, 2, 3);
        assertThat(continued.turns().get(1).toolExecutions()).extracting(ToolExecution::id).containsExactly("call_a");
        assertThat(continued.turns().get(2).toolExecutions()).isEmpty();
        assertThat(continued.totalToolCalls()).isEqualTo(1);
    }

    @Test
    void runLocksShouldStayBoundedAcrossRuns() {
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1_000; i++) {
            locks.add(store.lockFor("run-" + i));
        }

        assertThat(locks).hasSizeLessThanOrEqualTo(JdbcTraceStore.LOCK_STRIPES);
        assertThat(store.lockFor("run-7")).isSameAs(store.lockFor("run-7"));
    }

    @Test
    void unknownRunShouldFail() {
        assertThat(store.getRun("missing")).isEmpty();
        assertThatThrownBy(() -> store.appendTurn("missing",
                Turn.draft(1, "x", "y", List.of(), TokenUsage.ZERO, Instant.now(), 1)))
                .isInstanceOf(RunNotFoundException.class);
        assertThatThrownBy(() -> store.deleteRun("missing")).isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void deletingRunShouldCascadeToTurnsAndExecutions() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        store.logToolExecution(run.id(), ToolExecution.draft("call_1", 1, "echo", Map.of(), ToolResult.success("x")));

        store.deleteRun(run.id());

        assertThat(store.getRun(run.id())).isEmpty();
        assertThat(database.jdbc().getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM turns", Integer.class)).isZero();
        assertThat(database.jdbc().getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM tool_executions", Integer.class))
                .isZero();
    }

    @Test
    void deletingAgentShouldCascadeToRuns() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);

        agents.delete(agent.id());

        assertThat(store.getRun(run.id())).isEmpty();
    }

    @Test
    void queryRunsShouldFilterByAgentAndStatus() {
        Run first = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        Run second = store.createRun(agent.id(), "openai:gpt-4o-mini", null, 1);
        store.updateRunStatus(first.id(), RunStatus.COMPLETED, null);

        assertThat(store.queryRuns(RunQuery.forAgent(agent.id()))).hasSize(2);
        assertThat(store.queryRuns(new RunQuery(agent.id(), RunStatus.RUNNING, null, null, null, null)))
                .extracting(Run::id)
                .containsExactly(second.id());
        assertThat(store.queryRuns(new RunQuery(agent.id(), null, null, null, 1, 0))).hasSize(1);
        assertThat(store.queryRuns(RunQuery.forAgent("other"))).isEmpty();
    }

    @Test
    void toolStatsShouldReportCountsAndSuccessRate() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        store.logToolExecution(run.id(), ToolExecution.draft("e1", 1, "echo", Map.of(),
                ToolResult.success("a").withExecutionTime(10)));
        store.logToolExecution(run.id(), ToolExecution.draft("e2", 1, "echo", Map.of(),
                ToolResult.failure("bad").withExecutionTime(30)));
        store.logToolExecution(run.id(), ToolExecution.draft("c1", 1, "calculator", Map.of(),
                ToolResult.success("2").withExecutionTime(5)));

        List<ToolStats> stats = store.getToolStats(agent.id());

        assertThat(stats).extracting(ToolStats::toolName).containsExactly("calculator", "echo");
        ToolStats echo = stats.get(1);
        assertThat(echo.count()).isEqualTo(2);
        assertThat(echo.successCount()).isEqualTo(1);
        assertThat(echo.successRate()).isEqualTo(50.0);
        assertThat(echo.avgExecutionTimeMs()).isEqualTo(20.0);
    }

    @Test
    void versionMetadataShouldBeStoredAndCounted() {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 2);
        assertThat(store.countRunsWithMemory(agent.id())).isZero();

        store.updateRunVersion(run.id(), new RunVersion(2, 1, "abcdef0123456789", "2.1.abcdef0123456789"));

        assertThat(store.getRun(run.id()).orElseThrow().version().agentVersion()).isEqualTo("2.1.abcdef0123456789");
        assertThat(store.countRunsWithMemory(agent.id())).isEqualTo(1);
    }

    @Test
    void concurrentLoggingShouldNotLoseExecutions() throws Exception {
        Run run = store.createRun(agent.id(), "ollama:llama3.1", null, 1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<ToolExecution>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String id = "call_" + i;
                futures.add(executor.submit(() -> store.logToolExecution(run.id(),
                        ToolExecution.draft(id, 1, "echo", Map.of(), ToolResult.success(id)))));
            }
            for (Future<ToolExecution> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Run reloaded = store.getRun(run.id()).orElseThrow();
        assertThat(reloaded.turns()).singleElement()
                .satisfies(turn -> assertThat(turn.toolExecutions()).hasSize(20));
    }
}
