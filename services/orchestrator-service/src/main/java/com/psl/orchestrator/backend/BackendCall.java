package com.psl.orchestrator.backend;

import com.psl.orchestrator.backend.graph.GraphStrategy;
import com.psl.orchestrator.query.QueryParams;
import java.util.Map;

public class BackendCall {
    private final String queryText;
    private final int limit;
    private final QueryParams params;
    private final GraphStrategy graphStrategy;
    private final Map<String, Object> filters;
    private final Integer timeBudgetMs;

    public BackendCall(
        String queryText,
        int limit,
        QueryParams params,
        GraphStrategy graphStrategy,
        Map<String, Object> filters,
        Integer timeBudgetMs
    ) {
        this.queryText = queryText;
        this.limit = limit;
        this.params = params == null ? QueryParams.empty() : params;
        this.graphStrategy = graphStrategy == null ? GraphStrategy.COMPREHENSIVE : graphStrategy;
        this.filters = filters == null ? Map.of() : Map.copyOf(filters);
        this.timeBudgetMs = timeBudgetMs;
    }

    public static BackendCall of(String queryText, int limit) {
        return new BackendCall(queryText, limit, null, null, null, null);
    }

    public BackendCall withTimeBudgetMs(Integer budgetMs) {
        return new BackendCall(queryText, limit, params, graphStrategy, filters, budgetMs);
    }

    public String getQueryText() {
        return queryText;
    }

    public int getLimit() {
        return limit;
    }

    public QueryParams getParams() {
        return params;
    }

    public GraphStrategy getGraphStrategy() {
        return graphStrategy;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public Integer getTimeBudgetMs() {
        return timeBudgetMs;
    }
}
