package com.psl.orchestrator.plan;

import com.psl.orchestrator.intent.Classification;
import com.psl.orchestrator.intent.Intent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class BackendPlanner {
    private static final Map<Intent, Route> ROUTES = buildRoutes();

    public ExecutionPlan plan(String queryText, Classification<Intent> classification, int requestedLimit) {
        Intent intent = classification.getLabel();
        Route route = routeFor(intent);
        int limit = Math.max(1, requestedLimit);
        return new ExecutionPlan(
            intent,
            route.backends,
            ExecutionStrategy.forBackendCount(route.backends.size()),
            limit * route.limitMultiplier,
            limit,
            queryText,
            classification.getParams()
        );
    }

    /**
     * Backends the original plan did not use, run one at a time; null when every backend already ran.
     */
    public ExecutionPlan planEscalation(ExecutionPlan original) {
        List<Backend> remaining = new ArrayList<>(Backend.all());
        remaining.removeAll(original.getBackends());
        if (remaining.isEmpty()) {
            return null;
        }
        Route comprehensive = routeFor(Intent.COMPREHENSIVE);
        return new ExecutionPlan(
            Intent.COMPREHENSIVE,
            remaining,
            ExecutionStrategy.SEQUENTIAL,
            original.getRequestedLimit() * comprehensive.limitMultiplier,
            original.getRequestedLimit(),
            original.getQueryText(),
            original.getParams()
        );
    }

    public static List<Backend> backendsFor(Intent intent) {
        return routeFor(intent).backends;
    }

    private static Route routeFor(Intent intent) {
        Route route = ROUTES.get(intent);
        return route == null ? ROUTES.get(Intent.SEMANTIC) : route;
    }

    private static Map<Intent, Route> buildRoutes() {
        Map<Intent, Route> routes = new EnumMap<>(Intent.class);
        routes.put(Intent.SEMANTIC, new Route(1, Backend.VECTOR));
        routes.put(Intent.CONTENT_SIMILARITY, new Route(1, Backend.VECTOR));
        routes.put(Intent.CITATION, new Route(1, Backend.GRAPH));
        routes.put(Intent.INFLUENCE, new Route(1, Backend.GRAPH));
        routes.put(Intent.COLLABORATION, new Route(1, Backend.GRAPH));
        routes.put(Intent.CONCEPT_NETWORK, new Route(1, Backend.GRAPH));
        routes.put(Intent.RELATIONSHIP, new Route(2, Backend.VECTOR, Backend.GRAPH));
        routes.put(Intent.METADATA, new Route(2, Backend.VECTOR, Backend.METADATA));
        routes.put(Intent.TEMPORAL, new Route(2, Backend.GRAPH, Backend.METADATA));
        routes.put(Intent.VENUE, new Route(2, Backend.GRAPH, Backend.METADATA));
        routes.put(Intent.COMPREHENSIVE, new Route(2, Backend.VECTOR, Backend.GRAPH, Backend.METADATA));
        return Collections.unmodifiableMap(routes);
    }

    private static final class Route {
        private final int limitMultiplier;
        private final List<Backend> backends;

        private Route(int limitMultiplier, Backend... backends) {
            this.limitMultiplier = limitMultiplier;
            this.backends = List.of(backends);
        }
    }
}
