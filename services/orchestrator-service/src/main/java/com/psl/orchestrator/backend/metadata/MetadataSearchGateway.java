package com.psl.orchestrator.backend.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.backend.ItemMapper;
import com.psl.orchestrator.backend.JsonBackendClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class MetadataSearchGateway {
    private final JsonBackendClient client;

    public MetadataSearchGateway(
        @Qualifier("metadataRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        MetadataProperties properties
    ) {
        this.client = new JsonBackendClient("metadata service", properties.getBaseUrl(), restTemplate, objectMapper);
    }

    public List<Item> search(Map<String, Object> filters, int limit, Integer timeBudgetMs) {
        if (limit <= 0) {
            return List.of();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filters", filters == null ? Map.of() : filters);
        body.put("limit", limit);
        JsonNode response = client.postJson("/items/search", body, timeBudgetMs);
        return ItemMapper.readItems(response);
    }

    public Optional<Item> getItem(String itemId) {
        JsonNode node = client.getJson("/items/{id}", null, itemId);
        if (node == null) {
            return Optional.empty();
        }
        JsonNode itemNode = node.has("item") ? node.get("item") : node;
        return Optional.ofNullable(ItemMapper.readItem(itemNode));
    }

    public Optional<String> getFullText(String itemId) {
        JsonNode node = client.getJson("/items/{id}/fulltext", null, itemId);
        if (node == null) {
            return Optional.empty();
        }
        String text = node.isTextual() ? node.asText() : ItemMapper.readText(node, "content");
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text);
    }
}
