package com.linlay.agentengine.trace;

import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.model.TokenUsage;
import com.linlay.agentengine.persistence.JsonColumnCodec;
import com.linlay.agentengine.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational trace store. Every write that reads before it updates runs under a per-run
 * monitor and in one transaction, so concurrent writers of the same run cannot lose updates.
 * Monitors are striped by run id, so their number stays fixed however many runs are written.
 */
@Repository
public class JdbcTraceStore implements TraceStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTraceStore.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumnCodec json;
    static final int LOCK_STRIPES = 64;

    private final Object[] runLocks = new Object[LOCK_STRIPES];

    public JdbcTraceStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate, JsonColumnCodec json) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.json = json;
        for (int i = 0; i < runLocks.length; i++) {
            runLocks[i] = new Object();
        }
    }

    @Override
    public Run createRun(String agentId, String modelUsed, ModelSettings modelSettings, Integer promptVersion) {
        if (!StringUtils.hasText(agentId) || !StringUtils.hasText(modelUsed)) {
            throw new ValidationException("agentId and modelUsed are required to create a run");
        }
        String runId = UUID.randomUUID().toString();
        jdbc.update("""
                        INSERT INTO runs (id, agent_id, model_used, status, model_settings, prompt_version, created_at)
                        VALUES (:id, :agentId, :modelUsed, :status, :modelSettings, :promptVersion, :createdAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", runId)
                        .addValue("agentId", agentId)
                        .addValue("modelUsed", modelUsed)
                        .addValue("status", RunStatus.RUNNING.name())
                        .addValue("modelSettings", json.write(modelSettings == null ? ModelSettings.defaults() : modelSettings))
                        .addValue("promptVersion", promptVersion)
                        .addValue("createdAt", Timestamp.from(Instant.now())));
        log.debug("Created run {} for agent {} on {}", runId, agentId, modelUsed);
        return getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    @Override
    public Turn appendTurn(String runId, Turn turn) {
        synchronized (lockFor(runId)) {
            String turnId = transactionTemplate.execute(status -> {
                requireRun(runId);
                int lastFinalized = queryInt("""
                        SELECT COALESCE(MAX(turn_number), 0) FROM turns
                        WHERE run_id = :runId AND state = 'FINALIZED'
                        """, new MapSqlParameterSource("runId", runId));
                if (turn.turnNumber() != lastFinalized + 1) {
                    throw new ValidationException("Turn %d cannot follow turn %d of run %s"
                            .formatted(turn.turnNumber(), lastFinalized, runId));
                }

                Optional<Turn> provisional = findTurnRow(runId, turn.turnNumber());
                String id = provisional
                        .map(placeholder -> reconcileProvisionalTurn(placeholder, turn))
                        .orElseGet(() -> insertTurn(runId, turn, TurnState.FINALIZED));
                attachExecutions(runId, id, turn);

                int toolCalls = queryInt("SELECT COUNT(*) FROM tool_executions WHERE turn_id = :turnId",
                        new MapSqlParameterSource("turnId", id));
                jdbc.update("""
                                UPDATE runs SET
                                    total_input_tokens = total_input_tokens + :input,
                                    total_output_tokens = total_output_tokens + :output,
                                    total_tokens = total_tokens + :total,
                                    total_tool_calls = total_tool_calls + :toolCalls
                                WHERE id = :runId
                                """,
                        new MapSqlParameterSource()
                                .addValue("input", turn.usage().inputTokens())
                                .addValue("output", turn.usage().outputTokens())
                                .addValue("total", turn.usage().totalTokens())
                                .addValue("toolCalls", toolCalls)
                                .addValue("runId", runId));
                return id;
            });
            return loadTurn(turnId);
        }
    }

    @Override
    public ToolExecution logToolExecution(String runId, ToolExecution execution) {
        synchronized (lockFor(runId)) {
            String executionId = transactionTemplate.execute(status -> {
                requireRun(runId);
                String turnId = findTurnRow(runId, execution.turnNumber())
                        .map(Turn::id)
                        .orElseGet(() -> {
                            log.debug("No turn {} yet for run {}, creating provisional turn", execution.turnNumber(), runId);
                            return insertTurn(runId, provisionalTurn(execution.turnNumber()), TurnState.PROVISIONAL);
                        });
                return insertExecution(runId, turnId, execution);
            });
            return findExecution(executionId).orElseThrow();
        }
    }

    @Override
    public void updateRunStatus(String runId, RunStatus status, String error) {
        updateRunStatus(runId, status, error, null);
    }

    /**
     * Moves a running run to a terminal state. Placeholder turns still open at that point are
     * finalized as they are, so a later continuation numbers its turns after them.
     */
    @Override
    public void updateRunStatus(String runId, RunStatus status, String error, Long durationMs) {
        if (status == null || !status.isTerminal()) {
            throw new ValidationException("Run status can only move to a terminal state, use reopenRun to resume");
        }
        synchronized (lockFor(runId)) {
            transactionTemplate.executeWithoutResult(tx -> {
                int updated = jdbc.update("""
                                UPDATE runs SET status = :status, error = :error, completed_at = :completedAt,
                                    total_duration_ms = COALESCE(total_duration_ms, 0) + :duration
                                WHERE id = :runId AND status = 'RUNNING'
                                """,
                        new MapSqlParameterSource()
                                .addValue("status", status.name())
                                .addValue("error", error)
                                .addValue("completedAt", Timestamp.from(Instant.now()))
                                .addValue("duration", durationMs == null ? 0L : durationMs)
                                .addValue("runId", runId));
                if (updated == 0) {
                    RunStatus current = requireRun(runId);
                    throw new ValidationException("Run %s is already %s".formatted(runId, current));
                }
                closeProvisionalTurns(runId);
            });
        }
    }

    @Override
    public void reopenRun(String runId) {
        synchronized (lockFor(runId)) {
            RunStatus current = requireRun(runId);
            if (current == RunStatus.RUNNING) {
                throw new ValidationException("Run %s is still running".formatted(runId));
            }
            jdbc.update("UPDATE runs SET status = 'RUNNING', error = NULL, completed_at = NULL WHERE id = :runId",
                    new MapSqlParameterSource("runId", runId));
        }
    }

    @Override
    public void updateRunVersion(String runId, RunVersion version) {
        int updated = jdbc.update("""
                        UPDATE runs SET prompt_version = :promptVersion, memory_number = :memoryNumber,
                            memory_hash = :memoryHash, agent_version = :agentVersion
                        WHERE id = :runId
                        """,
                new MapSqlParameterSource()
                        .addValue("promptVersion", version.promptVersion())
                        .addValue("memoryNumber", version.memoryNumber())
                        .addValue("memoryHash", version.memoryHash())
                        .addValue("agentVersion", version.agentVersion())
                        .addValue("runId", runId));
        if (updated == 0) {
            throw new RunNotFoundException(runId);
        }
    }

    @Override
    public Optional<Run> getRun(String runId) {
        List<Run> runs = jdbc.query("SELECT * FROM runs WHERE id = :runId",
                new MapSqlParameterSource("runId", runId), runRowMapper(List.of()));
        if (runs.isEmpty()) {
            return Optional.empty();
        }
        Run run = runs.get(0);
        List<Turn> turns = loadTurns(runId);
        return Optional.of(new Run(
                run.id(), run.agentId(), run.modelUsed(), run.status(), run.usage(), run.totalToolCalls(),
                run.modelSettings(), run.createdAt(), run.completedAt(), run.error(), run.totalDurationMs(),
                run.version(), turns));
    }

    @Override
    public List<Run> queryRuns(RunQuery query) {
        RunQuery criteria = query == null ? new RunQuery(null, null, null, null, null, null) : query;
        StringBuilder sql = new StringBuilder("SELECT * FROM runs WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (StringUtils.hasText(criteria.agentId())) {
            sql.append(" AND agent_id = :agentId");
            params.addValue("agentId", criteria.agentId());
        }
        if (criteria.status() != null) {
            sql.append(" AND status = :status");
            params.addValue("status", criteria.status().name());
        }
        if (criteria.from() != null) {
            sql.append(" AND created_at >= :from");
            params.addValue("from", Timestamp.from(criteria.from()));
        }
        if (criteria.to() != null) {
            sql.append(" AND created_at <= :to");
            params.addValue("to", Timestamp.from(criteria.to()));
        }
        sql.append(" ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset");
        params.addValue("limit", criteria.limit());
        params.addValue("offset", criteria.offset());
        return jdbc.query(sql.toString(), params, runRowMapper(List.of()));
    }

    @Override
    public void deleteRun(String runId) {
        synchronized (lockFor(runId)) {
            int deleted = jdbc.update("DELETE FROM runs WHERE id = :runId", new MapSqlParameterSource("runId", runId));
            if (deleted == 0) {
                throw new RunNotFoundException(runId);
            }
        }
    }

    @Override
    public List<ToolStats> getToolStats(String agentId) {
        StringBuilder sql = new StringBuilder("""
                SELECT te.tool_name AS tool_name,
                       COUNT(*) AS total,
                       SUM(CASE WHEN te.success THEN 1 ELSE 0 END) AS successes,
                       AVG(CAST(te.execution_time_ms AS DOUBLE PRECISION)) AS avg_time
                FROM tool_executions te
                JOIN runs r ON r.id = te.run_id
                """);
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (StringUtils.hasText(agentId)) {
            sql.append(" WHERE r.agent_id = :agentId");
            params.addValue("agentId", agentId);
        }
        sql.append(" GROUP BY te.tool_name ORDER BY te.tool_name");
        return jdbc.query(sql.toString(), params, (rs, rowNum) -> {
            long total = rs.getLong("total");
            long successes = rs.getLong("successes");
            double successRate = total == 0 ? 0d : successes * 100d / total;
            return new ToolStats(rs.getString("tool_name"), total, successes, successRate, rs.getDouble("avg_time"));
        });
    }

    @Override
    public int countRunsWithMemory(String agentId) {
        return queryInt("SELECT COUNT(*) FROM runs WHERE agent_id = :agentId AND memory_hash IS NOT NULL",
                new MapSqlParameterSource("agentId", agentId));
    }

    Object lockFor(String runId) {
        return runLocks[Math.floorMod(runId.hashCode(), runLocks.length)];
    }

    private RunStatus requireRun(String runId) {
        List<String> statuses = jdbc.queryForList("SELECT status FROM runs WHERE id = :runId",
                new MapSqlParameterSource("runId", runId), String.class);
        if (statuses.isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        return RunStatus.fromValue(statuses.get(0));
    }

    /**
     * Finalizes a placeholder in place: the turn keeps its id, so executions logged against it
     * stay attached, and takes over the final content.
     */
    private String reconcileProvisionalTurn(Turn placeholder, Turn turn) {
        jdbc.update("""
                        UPDATE turns SET state = 'FINALIZED', user_message = :userMessage,
                            assistant_message = :assistantMessage, input_tokens = :input, output_tokens = :output,
                            total_tokens = :total, started_at = :startedAt, duration_ms = :durationMs,
                            recorded_at = :recordedAt
                        WHERE id = :id AND state = 'PROVISIONAL'
                        """,
                turnParams(turn).addValue("id", placeholder.id()));
        log.debug("Finalized provisional turn {} ({}) of run {}", placeholder.turnNumber(), placeholder.id(), placeholder.runId());
        return placeholder.id();
    }

    private void closeProvisionalTurns(String runId) {
        List<String> openTurns = jdbc.queryForList(
                "SELECT id FROM turns WHERE run_id = :runId AND state = 'PROVISIONAL' ORDER BY turn_number",
                new MapSqlParameterSource("runId", runId), String.class);
        for (String turnId : openTurns) {
            jdbc.update("UPDATE turns SET state = 'FINALIZED', recorded_at = :recordedAt WHERE id = :id",
                    new MapSqlParameterSource()
                            .addValue("recordedAt", Timestamp.from(Instant.now()))
                            .addValue("id", turnId));
            int toolCalls = queryInt("SELECT COUNT(*) FROM tool_executions WHERE turn_id = :turnId",
                    new MapSqlParameterSource("turnId", turnId));
            jdbc.update("UPDATE runs SET total_tool_calls = total_tool_calls + :toolCalls WHERE id = :runId",
                    new MapSqlParameterSource().addValue("toolCalls", toolCalls).addValue("runId", runId));
            log.debug("Closed open placeholder turn {} of run {} with {} execution(s)", turnId, runId, toolCalls);
        }
    }

    /**
     * Points every execution listed on the turn at the finalized turn id, inserting the ones
     * that were never logged.
     */
    private void attachExecutions(String runId, String turnId, Turn turn) {
        for (ToolExecution execution : turn.toolExecutions()) {
            Optional<ToolExecution> persisted = StringUtils.hasText(execution.id())
                    ? findExecution(execution.id())
                    : Optional.empty();
            if (persisted.isEmpty()) {
                insertExecution(runId, turnId, execution);
                continue;
            }
            if (!runId.equals(persisted.get().runId())) {
                throw new ValidationException("Tool execution %s belongs to another run".formatted(execution.id()));
            }
            if (!turnId.equals(persisted.get().turnId())) {
                jdbc.update("UPDATE tool_executions SET turn_id = :turnId WHERE id = :id",
                        new MapSqlParameterSource().addValue("turnId", turnId).addValue("id", execution.id()));
            }
        }
    }

    private Turn provisionalTurn(int turnNumber) {
        return new Turn(null, null, turnNumber, TurnState.PROVISIONAL, "", "", TokenUsage.ZERO,
                Instant.now(), null, Instant.now(), List.of());
    }

    private String insertTurn(String runId, Turn turn, TurnState state) {
        String turnId = UUID.randomUUID().toString();
        jdbc.update("""
                        INSERT INTO turns (id, run_id, turn_number, state, user_message, assistant_message,
                            input_tokens, output_tokens, total_tokens, started_at, duration_ms, recorded_at)
                        VALUES (:id, :runId, :turnNumber, :state, :userMessage, :assistantMessage,
                            :input, :output, :total, :startedAt, :durationMs, :recordedAt)
                        """,
                turnParams(turn)
                        .addValue("id", turnId)
                        .addValue("runId", runId)
                        .addValue("turnNumber", turn.turnNumber())
                        .addValue("state", state.name()));
        return turnId;
    }

    private MapSqlParameterSource turnParams(Turn turn) {
        return new MapSqlParameterSource()
                .addValue("userMessage", turn.userMessage())
                .addValue("assistantMessage", turn.assistantMessage())
                .addValue("input", turn.usage().inputTokens())
                .addValue("output", turn.usage().outputTokens())
                .addValue("total", turn.usage().totalTokens())
                .addValue("startedAt", turn.startedAt() == null ? null : Timestamp.from(turn.startedAt()))
                .addValue("durationMs", turn.durationMs())
                .addValue("recordedAt", Timestamp.from(turn.timestamp()));
    }

    private String insertExecution(String runId, String turnId, ToolExecution execution) {
        String id = execution.id();
        if (!StringUtils.hasText(id) || findExecution(id).isPresent()) {
            id = UUID.randomUUID().toString();
        }
        int order = queryInt("SELECT COALESCE(MAX(execution_order), 0) + 1 FROM tool_executions WHERE run_id = :runId",
                new MapSqlParameterSource("runId", runId));
        ToolResult result = execution.result();
        jdbc.update("""
                        INSERT INTO tool_executions (id, run_id, turn_id, execution_order, tool_name, parameters,
                            success, output, data, error, execution_time_ms, executed_at)
                        VALUES (:id, :runId, :turnId, :order, :toolName, :parameters,
                            :success, :output, :data, :error, :executionTimeMs, :executedAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("runId", runId)
                        .addValue("turnId", turnId)
                        .addValue("order", order)
                        .addValue("toolName", execution.toolName())
                        .addValue("parameters", json.write(execution.parameters()))
                        .addValue("success", result.success())
                        .addValue("output", result.output())
                        .addValue("data", json.write(result.data()))
                        .addValue("error", result.error())
                        .addValue("executionTimeMs", result.executionTimeMs())
                        .addValue("executedAt", Timestamp.from(execution.timestamp())));
        return id;
    }

    private Optional<Turn> findTurnRow(String runId, int turnNumber) {
        List<Turn> turns = jdbc.query("SELECT * FROM turns WHERE run_id = :runId AND turn_number = :turnNumber",
                new MapSqlParameterSource().addValue("runId", runId).addValue("turnNumber", turnNumber),
                turnRowMapper(Map.of()));
        return turns.stream().findFirst();
    }

    private Optional<ToolExecution> findExecution(String executionId) {
        List<ToolExecution> executions = jdbc.query("""
                        SELECT te.*, t.turn_number FROM tool_executions te
                        JOIN turns t ON t.id = te.turn_id
                        WHERE te.id = :id
                        """,
                new MapSqlParameterSource("id", executionId), this::mapExecution);
        return executions.stream().findFirst();
    }

    private Turn loadTurn(String turnId) {
        Turn row = jdbc.queryForObject("SELECT * FROM turns WHERE id = :id",
                new MapSqlParameterSource("id", turnId), turnRowMapper(Map.of()));
        List<ToolExecution> executions = jdbc.query("""
                        SELECT te.*, t.turn_number FROM tool_executions te
                        JOIN turns t ON t.id = te.turn_id
                        WHERE te.turn_id = :turnId ORDER BY te.execution_order
                        """,
                new MapSqlParameterSource("turnId", turnId), this::mapExecution);
        return withExecutions(row, executions);
    }

    private List<Turn> loadTurns(String runId) {
        Map<String, List<ToolExecution>> executionsByTurn = new LinkedHashMap<>();
        jdbc.query("""
                        SELECT te.*, t.turn_number FROM tool_executions te
                        JOIN turns t ON t.id = te.turn_id
                        WHERE te.run_id = :runId ORDER BY te.execution_order
                        """,
                new MapSqlParameterSource("runId", runId), this::mapExecution)
                .forEach(execution -> executionsByTurn
                        .computeIfAbsent(execution.turnId(), ignored -> new ArrayList<>())
                        .add(execution));
        return jdbc.query("SELECT * FROM turns WHERE run_id = :runId ORDER BY turn_number",
                new MapSqlParameterSource("runId", runId), turnRowMapper(executionsByTurn));
    }

    private Turn withExecutions(Turn turn, List<ToolExecution> executions) {
        return new Turn(turn.id(), turn.runId(), turn.turnNumber(), turn.state(), turn.userMessage(),
                turn.assistantMessage(), turn.usage(), turn.startedAt(), turn.durationMs(), turn.timestamp(), executions);
    }

    private RowMapper<Turn> turnRowMapper(Map<String, List<ToolExecution>> executionsByTurn) {
        return (rs, rowNum) -> {
            String id = rs.getString("id");
            return new Turn(
                    id,
                    rs.getString("run_id"),
                    rs.getInt("turn_number"),
                    TurnState.valueOf(rs.getString("state")),
                    rs.getString("user_message"),
                    rs.getString("assistant_message"),
                    new TokenUsage(rs.getLong("input_tokens"), rs.getLong("output_tokens")),
                    instant(rs, "started_at"),
                    nullableLong(rs, "duration_ms"),
                    instant(rs, "recorded_at"),
                    executionsByTurn.getOrDefault(id, List.of())
            );
        };
    }

    private ToolExecution mapExecution(ResultSet rs, int rowNum) throws SQLException {
        ToolResult result = new ToolResult(
                rs.getBoolean("success"),
                rs.getString("output"),
                json.readValue(rs.getString("data")),
                rs.getString("error"),
                rs.getLong("execution_time_ms")
        );
        return new ToolExecution(
                rs.getString("id"),
                rs.getString("run_id"),
                rs.getString("turn_id"),
                rs.getInt("turn_number"),
                rs.getString("tool_name"),
                json.readMap(rs.getString("parameters")),
                result,
                instant(rs, "executed_at")
        );
    }

    private RowMapper<Run> runRowMapper(List<Turn> turns) {
        return (rs, rowNum) -> new Run(
                rs.getString("id"),
                rs.getString("agent_id"),
                rs.getString("model_used"),
                RunStatus.fromValue(rs.getString("status")),
                new TokenUsage(rs.getLong("total_input_tokens"), rs.getLong("total_output_tokens")),
                rs.getInt("total_tool_calls"),
                json.readValue(rs.getString("model_settings"), ModelSettings.class),
                instant(rs, "created_at"),
                instant(rs, "completed_at"),
                rs.getString("error"),
                nullableLong(rs, "total_duration_ms"),
                new RunVersion(
                        nullableInt(rs, "prompt_version"),
                        nullableInt(rs, "memory_number"),
                        rs.getString("memory_hash"),
                        rs.getString("agent_version")
                ),
                turns
        );
    }

    private int queryInt(String sql, MapSqlParameterSource params) {
        Integer value = jdbc.queryForObject(sql, params, Integer.class);
        return value == null ? 0 : value;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
