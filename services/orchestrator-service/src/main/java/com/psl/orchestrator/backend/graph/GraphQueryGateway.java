package com.psl.orchestrator.backend.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.ItemMapper;
import com.psl.orchestrator.backend.JsonBackendClient;
import com.psl.orchestrator.query.QueryParams;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class GraphQueryGateway {
    private final JsonBackendClient client;
    private final GraphProperties properties;

    public GraphQueryGateway(
        @Qualifier("graphRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        GraphProperties properties
    ) {
        this.client = new JsonBackendClient("graph store", properties.getBaseUrl(), restTemplate, objectMapper);
        this.properties = properties;
    }

    public GraphQueryResult query(GraphStrategy strategy, QueryParams params, String queryText, int limit) {
        return query(strategy, params, queryText, limit, properties.getMaxHops(), null);
    }

    public GraphQueryResult query(
        GraphStrategy strategy,
        QueryParams params,
        String queryText,
        int limit,
        int maxHops,
        Integer timeBudgetMs
    ) {
        GraphStrategy resolved = strategy == null ? GraphStrategy.COMPREHENSIVE : strategy;
        Map<String, Object> wireParams = new LinkedHashMap<>(params == null ? Map.of() : params.toMap());
        if (queryText != null && !queryText.isBlank()) {
            wireParams.put("query", queryText);
        }
        wireParams.put("max_hops", Math.max(1, maxHops));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("strategy", resolved.wireName());
        body.put("params", wireParams);
        body.put("limit", Math.max(1, limit));

        JsonNode response = client.postJson("/query", body, timeBudgetMs);
        List<JsonNode> records = new ArrayList<>();
        for (JsonNode record : response.path("results")) {
            records.add(record);
        }
        return new GraphQueryResult(resolved, records, flattenItems(records));
    }

    /**
     * Entities contribute the items they relate to; plain records are items themselves.
     */
    static List<Item> flattenItems(List<JsonNode> records) {
        List<Item> items = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode record : records) {
            JsonNode related = record.path("related_items");
            if (related.isArray()) {
                for (JsonNode relatedNode : related) {
                    addItem(items, seen, ItemMapper.readItem(relatedNode));
                }
            }
            String paperKey = ItemMapper.readText(record, "paper_key");
            if (paperKey != null) {
                addItem(items, seen, new Item(
                    paperKey,
                    ItemMapper.readText(record, "title"),
                    null,
                    ItemMapper.readInteger(record, "year"),
                    null,
                    null,
                    null
                ));
            } else if (!related.isArray()) {
                addItem(items, seen, ItemMapper.readItem(record));
            }
        }
        return items;
    }

    private static void addItem(List<Item> items, Set<String> seen, Item item) {
        if (item != null && seen.add(item.getId())) {
            items.add(item);
        }
    }
}
