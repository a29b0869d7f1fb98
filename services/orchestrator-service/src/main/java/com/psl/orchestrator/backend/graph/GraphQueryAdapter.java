package com.psl.orchestrator.backend.graph;

import com.psl.orchestrator.backend.BackendAdapter;
import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GraphQueryAdapter implements BackendAdapter {
    private static final Logger log = LoggerFactory.getLogger(GraphQueryAdapter.class);

    private final GraphQueryGateway gateway;
    private final GraphProperties properties;

    public GraphQueryAdapter(GraphQueryGateway gateway, GraphProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    @Override
    public Backend backend() {
        return Backend.GRAPH;
    }

    @Override
    public List<Item> retrieve(BackendCall call) {
        GraphStrategy strategy = call.getGraphStrategy();
        String missing = strategy.missingParameter(call.getParams());
        if (missing != null) {
            log.debug("Graph strategy {} lacks {}; using {}", strategy.wireName(), missing,
                GraphStrategy.COMPREHENSIVE.wireName());
            strategy = GraphStrategy.COMPREHENSIVE;
        }
        return gateway.query(
            strategy,
            call.getParams(),
            call.getQueryText(),
            call.getLimit(),
            properties.getMaxHops(),
            call.getTimeBudgetMs()
        ).getItems();
    }
}
