package com.psl.orchestrator.plan;

import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.graph.GraphStrategy;
import com.psl.orchestrator.intent.Intent;
import com.psl.orchestrator.query.QueryParams;
import java.util.List;
import java.util.Objects;

public final class ExecutionPlan {
    private final Intent intent;
    private final List<Backend> backends;
    private final ExecutionStrategy strategy;
    private final int perBackendLimit;
    private final int requestedLimit;
    private final String queryText;
    private final QueryParams params;

    public ExecutionPlan(
        Intent intent,
        List<Backend> backends,
        ExecutionStrategy strategy,
        int perBackendLimit,
        int requestedLimit,
        String queryText,
        QueryParams params
    ) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.backends = List.copyOf(backends);
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.perBackendLimit = perBackendLimit;
        this.requestedLimit = requestedLimit;
        this.queryText = queryText == null ? "" : queryText;
        this.params = params == null ? QueryParams.empty() : params;
    }

    public Intent getIntent() {
        return intent;
    }

    public List<Backend> getBackends() {
        return backends;
    }

    public ExecutionStrategy getStrategy() {
        return strategy;
    }

    public int getPerBackendLimit() {
        return perBackendLimit;
    }

    public int getRequestedLimit() {
        return requestedLimit;
    }

    public String getQueryText() {
        return queryText;
    }

    public QueryParams getParams() {
        return params;
    }

    public boolean isEmpty() {
        return backends.isEmpty();
    }

    public BackendCall callFor(Backend backend, Integer timeBudgetMs) {
        GraphStrategy graphStrategy = backend == Backend.GRAPH ? intent.graphStrategy() : null;
        return new BackendCall(queryText, perBackendLimit, params, graphStrategy, null, timeBudgetMs);
    }

    @Override
    public String toString() {
        return intent.wireName() + backends + "/" + strategy.wireName() + "@" + perBackendLimit;
    }
}
