package com.linlay.agentengine.agent;

import java.util.List;

/**
 * Listing filter. An agent matches when it carries any of {@code tags} and its name or
 * description contains {@code search}. Null or empty criteria do not filter.
 */
public record AgentFilter(
        List<String> tags,
        String search,
        OrderBy orderBy,
        boolean ascending,
        Integer limit,
        Integer offset
) {

    public static final int DEFAULT_LIMIT = 50;

    public enum OrderBy {
        NAME("name"),
        CREATED_AT("created_at"),
        UPDATED_AT("updated_at");

        private final String column;

        OrderBy(String column) {
            this.column = column;
        }

        String column() {
            return column;
        }
    }

    public AgentFilter {
        tags = tags == null ? List.of() : List.copyOf(tags);
        orderBy = orderBy == null ? OrderBy.UPDATED_AT : orderBy;
        limit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        offset = offset == null || offset < 0 ? 0 : offset;
    }

    public static AgentFilter all() {
        return new AgentFilter(List.of(), null, null, false, null, null);
    }

    public static AgentFilter byTags(List<String> tags) {
        return new AgentFilter(tags, null, null, false, null, null);
    }

    public static AgentFilter search(String search) {
        return new AgentFilter(List.of(), search, null, false, null, null);
    }
}
