package com.psl.orchestrator.backend;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ItemMapper {
    private ItemMapper() {
    }

    public static List<Item> readItems(JsonNode response) {
        List<Item> items = new ArrayList<>();
        if (response == null) {
            return items;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode node : response.path("results")) {
            Item item = readItem(node);
            if (item != null && seen.add(item.getId())) {
                items.add(item);
            }
        }
        return items;
    }

    public static Item readItem(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String id = readText(node, "id");
        if (id == null) {
            id = readText(node, "item_key");
        }
        if (id == null) {
            return null;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode metadataNode = node.path("metadata");
        if (metadataNode.isObject()) {
            metadataNode.fields().forEachRemaining(entry -> metadata.put(entry.getKey(), toValue(entry.getValue())));
        }
        String abstractText = readText(node, "abstract");
        if (abstractText != null) {
            metadata.put("abstract", abstractText);
        }
        String venue = readText(node, "venue");
        if (venue != null) {
            metadata.put("venue", venue);
        }
        String chunkId = readText(node, "chunk_id");
        if (chunkId != null) {
            metadata.put("chunk_id", chunkId);
        }
        String snippet = readText(node, "snippet");
        if (snippet == null) {
            snippet = readText(node, "content");
        }

        JsonNode scoreNode = node.path("score");
        Double score = scoreNode.isNumber() ? scoreNode.asDouble() : null;

        return new Item(
            id,
            readText(node, "title"),
            snippet,
            readInteger(node, "year"),
            readAuthors(node.path("authors")),
            metadata,
            score
        );
    }

    public static String readText(JsonNode node, String fieldName) {
        JsonNode value = node.path(fieldName);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText(null);
        if (text == null || text.isBlank()) {
            return null;
        }
        return text;
    }

    public static Integer readInteger(JsonNode node, String fieldName) {
        JsonNode value = node.path(fieldName);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        String text = value.asText("");
        try {
            return text.isBlank() ? null : Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<String> readAuthors(JsonNode authorsNode) {
        List<String> authors = new ArrayList<>();
        if (!authorsNode.isArray()) {
            return authors;
        }
        for (JsonNode authorNode : authorsNode) {
            if (authorNode.isTextual()) {
                authors.add(authorNode.asText());
            } else if (authorNode.isObject()) {
                String name = readText(authorNode, "name");
                if (name != null) {
                    authors.add(name);
                }
            }
        }
        return authors;
    }

    private static Object toValue(JsonNode node) {
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }
}
