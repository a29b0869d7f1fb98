package com.psl.orchestrator.explore;

import com.psl.orchestrator.query.QueryParams;

public final class ExplorationRequest {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_HOPS_CAP = 5;

    private final String queryText;
    private final QueryParams params;
    private final String forceMode;
    private final int limit;
    private final int maxHops;

    public ExplorationRequest(String queryText, QueryParams params, String forceMode, Integer limit, Integer maxHops) {
        this.queryText = queryText == null ? "" : queryText.trim();
        this.params = params == null ? QueryParams.empty() : params;
        this.forceMode = forceMode;
        this.limit = limit == null || limit <= 0 ? DEFAULT_LIMIT : limit;
        this.maxHops = maxHops == null || maxHops <= 0 ? 0 : Math.min(maxHops, MAX_HOPS_CAP);
    }

    public String getQueryText() {
        return queryText;
    }

    public QueryParams getParams() {
        return params;
    }

    public String getForceMode() {
        return forceMode;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Zero means the configured graph default.
     */
    public int getMaxHops() {
        return maxHops;
    }
}
