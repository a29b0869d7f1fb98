package com.psl.orchestrator.backend.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.orchestrator.backend.Item;
import java.util.List;

/**
 * Raw graph records alongside the items they reference. Records keep strategy-specific fields
 * (collaborator names, hop counts, venues) that do not fit the item shape.
 */
public class GraphQueryResult {
    private final GraphStrategy strategy;
    private final List<JsonNode> records;
    private final List<Item> items;

    public GraphQueryResult(GraphStrategy strategy, List<JsonNode> records, List<Item> items) {
        this.strategy = strategy;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    public GraphStrategy getStrategy() {
        return strategy;
    }

    public List<JsonNode> getRecords() {
        return records;
    }

    public List<Item> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
