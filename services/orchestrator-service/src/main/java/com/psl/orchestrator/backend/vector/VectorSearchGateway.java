package com.psl.orchestrator.backend.vector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.ItemMapper;
import com.psl.orchestrator.backend.JsonBackendClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class VectorSearchGateway {
    private final JsonBackendClient client;

    public VectorSearchGateway(
        @Qualifier("vectorRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        VectorSearchProperties properties
    ) {
        this.client = new JsonBackendClient("vector store", properties.getBaseUrl(), restTemplate, objectMapper);
    }

    public List<Item> search(String queryText, int limit) {
        return search(queryText, limit, Map.of(), null);
    }

    public List<Item> search(String queryText, int limit, Map<String, Object> filters, Integer timeBudgetMs) {
        if (queryText == null || queryText.isBlank() || limit <= 0) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", queryText);
        body.put("limit", limit);
        if (filters != null && !filters.isEmpty()) {
            body.put("filters", filters);
        }
        JsonNode response = client.postJson("/search", body, timeBudgetMs);
        return ItemMapper.readItems(response);
    }
}
