package com.linlay.agentengine.agent;

import com.linlay.agentengine.error.ValidationException;
import com.linlay.agentengine.model.ModelSettings;
import com.linlay.agentengine.persistence.JsonColumnCodec;
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
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcAgentRepository implements AgentRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumnCodec json;

    public JdbcAgentRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate, JsonColumnCodec json) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.json = json;
    }

    @Override
    public Agent create(AgentDraft draft) {
        validateForCreate(draft);
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        transactionTemplate.executeWithoutResult(status -> {
            jdbc.update("""
                            INSERT INTO agents (id, name, description, system_prompt, prompt_version, default_model,
                                allowed_tools, tags, settings, message_window_size, structured_memory, created_at, updated_at)
                            VALUES (:id, :name, :description, :systemPrompt, 1, :defaultModel,
                                :allowedTools, :tags, :settings, :windowSize, :structuredMemory, :now, :now)
                            """,
                    new MapSqlParameterSource()
                            .addValue("id", id)
                            .addValue("name", draft.name().trim())
                            .addValue("description", draft.description() == null ? "" : draft.description())
                            .addValue("systemPrompt", draft.systemPrompt())
                            .addValue("defaultModel", draft.defaultModel().trim())
                            .addValue("allowedTools", json.write(listOrEmpty(draft.allowedTools())))
                            .addValue("tags", json.write(listOrEmpty(draft.tags())))
                            .addValue("settings", json.write(draft.settings() == null ? ModelSettings.defaults() : draft.settings()))
                            .addValue("windowSize", normalizeWindowSize(draft.messageWindowSize()))
                            .addValue("structuredMemory", Boolean.TRUE.equals(draft.structuredMemoryEnabled()))
                            .addValue("now", Timestamp.from(now)));
            insertPromptVersion(id, 1, draft.systemPrompt(), "Initial version", now);
        });
        log.info("Created agent {} ({})", id, draft.name());
        return findById(id).orElseThrow(() -> new AgentNotFoundException(id));
    }

    @Override
    public Optional<Agent> findById(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return jdbc.query("SELECT * FROM agents WHERE id = :id", new MapSqlParameterSource("id", id), agentRowMapper())
                .stream()
                .findFirst();
    }

    @Override
    public List<Agent> findAll(AgentFilter filter) {
        AgentFilter criteria = filter == null ? AgentFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT * FROM agents WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();

        List<String> tags = criteria.tags().stream().filter(StringUtils::hasText).toList();
        if (!tags.isEmpty()) {
            // tags is a JSON string array; match the quoted element
            sql.append(" AND (");
            for (int i = 0; i < tags.size(); i++) {
                if (i > 0) {
                    sql.append(" OR ");
                }
                sql.append("tags LIKE :tag").append(i);
                params.addValue("tag" + i, "%" + json.write(tags.get(i)) + "%");
            }
            sql.append(")");
        }
        if (StringUtils.hasText(criteria.search())) {
            sql.append(" AND (LOWER(name) LIKE :search OR LOWER(description) LIKE :search)");
            params.addValue("search", "%" + criteria.search().trim().toLowerCase(Locale.ROOT) + "%");
        }
        sql.append(" ORDER BY ").append(criteria.orderBy().column())
                .append(criteria.ascending() ? " ASC" : " DESC")
                .append(", id LIMIT :limit OFFSET :offset");
        params.addValue("limit", criteria.limit());
        params.addValue("offset", criteria.offset());
        return jdbc.query(sql.toString(), params, agentRowMapper());
    }

    @Override
    public Agent update(String id, AgentDraft draft, String commitMessage) {
        if (draft == null) {
            throw new ValidationException("Agent update cannot be null");
        }
        if (draft.name() != null && !StringUtils.hasText(draft.name())) {
            throw new ValidationException("Agent name cannot be blank");
        }
        if (draft.systemPrompt() != null && !StringUtils.hasText(draft.systemPrompt())) {
            throw new ValidationException("System prompt cannot be blank");
        }
        Instant now = Instant.now();
        transactionTemplate.executeWithoutResult(status -> {
            Agent existing = findById(id).orElseThrow(() -> new AgentNotFoundException(id));
            int promptVersion = existing.promptVersion();
            String systemPrompt = existing.systemPrompt();
            if (draft.systemPrompt() != null && !Objects.equals(draft.systemPrompt(), existing.systemPrompt())) {
                promptVersion = nextPromptVersion(id);
                systemPrompt = draft.systemPrompt();
                insertPromptVersion(id, promptVersion, systemPrompt, commitMessage, now);
                log.info("Agent {} prompt moved to version {}", id, promptVersion);
            }
            jdbc.update("""
                            UPDATE agents SET name = :name, description = :description, system_prompt = :systemPrompt,
                                prompt_version = :promptVersion, default_model = :defaultModel,
                                allowed_tools = :allowedTools, tags = :tags, settings = :settings,
                                message_window_size = :windowSize, structured_memory = :structuredMemory,
                                updated_at = :now
                            WHERE id = :id
                            """,
                    new MapSqlParameterSource()
                            .addValue("id", id)
                            .addValue("name", draft.name() != null ? draft.name().trim() : existing.name())
                            .addValue("description", draft.description() != null ? draft.description() : existing.description())
                            .addValue("systemPrompt", systemPrompt)
                            .addValue("promptVersion", promptVersion)
                            .addValue("defaultModel", StringUtils.hasText(draft.defaultModel())
                                    ? draft.defaultModel().trim()
                                    : existing.defaultModel())
                            .addValue("allowedTools", json.write(draft.allowedTools() != null
                                    ? draft.allowedTools()
                                    : existing.allowedTools()))
                            .addValue("tags", json.write(draft.tags() != null ? draft.tags() : existing.tags()))
                            .addValue("settings", json.write(draft.settings() != null ? draft.settings() : existing.settings()))
                            .addValue("windowSize", draft.messageWindowSize() != null
                                    ? normalizeWindowSize(draft.messageWindowSize())
                                    : existing.messageWindowSize())
                            .addValue("structuredMemory", draft.structuredMemoryEnabled() != null
                                    ? draft.structuredMemoryEnabled()
                                    : existing.structuredMemoryEnabled())
                            .addValue("now", Timestamp.from(now)));
        });
        return findById(id).orElseThrow(() -> new AgentNotFoundException(id));
    }

    @Override
    public void delete(String id) {
        int deleted = jdbc.update("DELETE FROM agents WHERE id = :id", new MapSqlParameterSource("id", id));
        if (deleted == 0) {
            throw new AgentNotFoundException(id);
        }
        log.info("Deleted agent {}", id);
    }

    @Override
    public boolean exists(String id) {
        if (!StringUtils.hasText(id)) {
            return false;
        }
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM agents WHERE id = :id",
                new MapSqlParameterSource("id", id), Integer.class);
        return count != null && count > 0;
    }

    @Override
    public List<PromptVersion> listPromptVersions(String agentId) {
        if (!exists(agentId)) {
            throw new AgentNotFoundException(agentId);
        }
        return jdbc.query("SELECT * FROM prompt_versions WHERE agent_id = :agentId ORDER BY version DESC",
                new MapSqlParameterSource("agentId", agentId), this::mapPromptVersion);
    }

    @Override
    public Optional<PromptVersion> findPromptVersion(String agentId, int version) {
        return jdbc.query("SELECT * FROM prompt_versions WHERE agent_id = :agentId AND version = :version",
                        new MapSqlParameterSource().addValue("agentId", agentId).addValue("version", version),
                        this::mapPromptVersion)
                .stream()
                .findFirst();
    }

    @Override
    public Agent revertToPromptVersion(String agentId, int version) {
        if (!exists(agentId)) {
            throw new AgentNotFoundException(agentId);
        }
        PromptVersion target = findPromptVersion(agentId, version)
                .orElseThrow(() -> new ValidationException(
                        "Prompt version %d does not exist for agent %s".formatted(version, agentId)));
        Instant now = Instant.now();
        transactionTemplate.executeWithoutResult(status -> {
            int next = nextPromptVersion(agentId);
            insertPromptVersion(agentId, next, target.systemPrompt(), "Reverted to version " + version, now);
            jdbc.update("""
                            UPDATE agents SET system_prompt = :systemPrompt, prompt_version = :version, updated_at = :now
                            WHERE id = :id
                            """,
                    new MapSqlParameterSource()
                            .addValue("systemPrompt", target.systemPrompt())
                            .addValue("version", next)
                            .addValue("now", Timestamp.from(now))
                            .addValue("id", agentId));
            log.info("Agent {} prompt reverted to version {} as version {}", agentId, version, next);
        });
        return findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    private void validateForCreate(AgentDraft draft) {
        if (draft == null) {
            throw new ValidationException("Agent definition cannot be null");
        }
        if (!StringUtils.hasText(draft.name())) {
            throw new ValidationException("Agent name is required");
        }
        if (!StringUtils.hasText(draft.systemPrompt())) {
            throw new ValidationException("System prompt is required");
        }
        if (!StringUtils.hasText(draft.defaultModel())) {
            throw new ValidationException("Default model is required");
        }
    }

    private int nextPromptVersion(String agentId) {
        Integer max = jdbc.queryForObject("SELECT COALESCE(MAX(version), 0) FROM prompt_versions WHERE agent_id = :agentId",
                new MapSqlParameterSource("agentId", agentId), Integer.class);
        return (max == null ? 0 : max) + 1;
    }

    private void insertPromptVersion(String agentId, int version, String systemPrompt, String commitMessage, Instant at) {
        jdbc.update("""
                        INSERT INTO prompt_versions (id, agent_id, version, system_prompt, commit_message, created_at)
                        VALUES (:id, :agentId, :version, :systemPrompt, :commitMessage, :createdAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("id", UUID.randomUUID().toString())
                        .addValue("agentId", agentId)
                        .addValue("version", version)
                        .addValue("systemPrompt", systemPrompt)
                        .addValue("commitMessage", commitMessage)
                        .addValue("createdAt", Timestamp.from(at)));
    }

    private static Integer normalizeWindowSize(Integer windowSize) {
        return windowSize == null || windowSize <= 0 ? null : windowSize;
    }

    private static <T> List<T> listOrEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    private RowMapper<Agent> agentRowMapper() {
        return (rs, rowNum) -> {
            int windowSize = rs.getInt("message_window_size");
            Integer messageWindowSize = rs.wasNull() ? null : windowSize;
            return new Agent(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getString("system_prompt"),
                    rs.getInt("prompt_version"),
                    rs.getString("default_model"),
                    json.readStringList(rs.getString("allowed_tools")),
                    json.readStringList(rs.getString("tags")),
                    json.readValue(rs.getString("settings"), ModelSettings.class),
                    messageWindowSize,
                    rs.getBoolean("structured_memory"),
                    instant(rs, "created_at"),
                    instant(rs, "updated_at")
            );
        };
    }

    private PromptVersion mapPromptVersion(ResultSet rs, int rowNum) throws SQLException {
        return new PromptVersion(
                rs.getString("id"),
                rs.getString("agent_id"),
                rs.getInt("version"),
                rs.getString("system_prompt"),
                rs.getString("commit_message"),
                instant(rs, "created_at")
        );
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }
}
