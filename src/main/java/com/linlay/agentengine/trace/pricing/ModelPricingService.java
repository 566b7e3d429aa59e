package com.linlay.agentengine.trace.pricing;

import com.linlay.agentengine.config.AgentProviderProperties;
import com.linlay.agentengine.model.ModelRef;
import com.linlay.agentengine.trace.Run;
import com.linlay.agentengine.trace.RunNotFoundException;
import com.linlay.agentengine.trace.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Cached model pricing and run cost. An unknown price yields an empty cost, never zero.
 */
@Service
public class ModelPricingService {

    private static final Logger log = LoggerFactory.getLogger(ModelPricingService.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final TraceStore traceStore;
    private final List<ModelPricingSource> sources;
    private final AgentProviderProperties providerProperties;
    private final Object writeLock = new Object();

    public ModelPricingService(
            NamedParameterJdbcTemplate jdbc,
            TraceStore traceStore,
            List<ModelPricingSource> sources,
            AgentProviderProperties providerProperties
    ) {
        this.jdbc = jdbc;
        this.traceStore = traceStore;
        this.sources = List.copyOf(sources);
        this.providerProperties = providerProperties;
    }

    public Optional<ModelPricing> getModelPricing(String modelId, String provider, boolean forceUpdate) {
        if (!forceUpdate) {
            Optional<ModelPricing> cached = findCached(modelId, provider);
            if (cached.isPresent()) {
                return cached;
            }
        }
        for (ModelPricingSource source : sources) {
            Optional<ModelPricing> fetched = source.fetch(modelId, provider);
            if (fetched.isPresent()) {
                save(fetched.get());
                return fetched;
            }
        }
        log.debug("No pricing available for {}:{}", provider, modelId);
        return forceUpdate ? findCached(modelId, provider) : Optional.empty();
    }

    public Optional<RunCost> calculateRunCost(String runId) {
        Run run = traceStore.getRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        ModelRef ref = ModelRef.parse(run.modelUsed(), providerProperties.getDefaultProvider());
        return getModelPricing(ref.model(), ref.provider(), false)
                .map(pricing -> new RunCost(
                        run.id(),
                        ref.model(),
                        ref.provider(),
                        run.usage().inputTokens(),
                        run.usage().outputTokens(),
                        run.usage().inputTokens() / 1000d * pricing.inputPricePer1k(),
                        run.usage().outputTokens() / 1000d * pricing.outputPricePer1k()
                ));
    }

    private Optional<ModelPricing> findCached(String modelId, String provider) {
        return jdbc.query("""
                                SELECT model_id, provider, input_price_per_1k, output_price_per_1k, last_updated
                                FROM model_pricing WHERE model_id = :modelId AND provider = :provider
                                """,
                        new MapSqlParameterSource().addValue("modelId", modelId).addValue("provider", provider),
                        (rs, rowNum) -> new ModelPricing(
                                rs.getString("model_id"),
                                rs.getString("provider"),
                                rs.getDouble("input_price_per_1k"),
                                rs.getDouble("output_price_per_1k"),
                                rs.getTimestamp("last_updated").toInstant()
                        ))
                .stream()
                .findFirst();
    }

    private void save(ModelPricing pricing) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("modelId", pricing.modelId())
                .addValue("provider", pricing.provider())
                .addValue("input", pricing.inputPricePer1k())
                .addValue("output", pricing.outputPricePer1k())
                .addValue("lastUpdated", Timestamp.from(pricing.lastUpdated()));
        synchronized (writeLock) {
            int updated = jdbc.update("""
                    UPDATE model_pricing SET input_price_per_1k = :input, output_price_per_1k = :output,
                        last_updated = :lastUpdated
                    WHERE model_id = :modelId AND provider = :provider
                    """, params);
            if (updated == 0) {
                jdbc.update("""
                        INSERT INTO model_pricing (id, model_id, provider, input_price_per_1k, output_price_per_1k, last_updated)
                        VALUES (:id, :modelId, :provider, :input, :output, :lastUpdated)
                        """, params.addValue("id", UUID.randomUUID().toString()));
            }
        }
    }
}
