package com.linlay.agentengine.trace;

import java.time.Instant;

/**
 * Filter for {@link TraceStore#queryRuns(RunQuery)}. Null fields do not filter.
 */
public record RunQuery(
        String agentId,
        RunStatus status,
        Instant from,
        Instant to,
        Integer limit,
        Integer offset
) {

    public static final int DEFAULT_LIMIT = 50;

    public RunQuery {
        limit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        offset = offset == null || offset < 0 ? 0 : offset;
    }

    public static RunQuery forAgent(String agentId) {
        return new RunQuery(agentId, null, null, null, null, null);
    }
}
