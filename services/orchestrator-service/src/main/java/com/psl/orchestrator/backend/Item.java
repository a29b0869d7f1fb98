package com.psl.orchestrator.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Item {
    private final String id;
    private final String title;
    private final String snippet;
    private final Integer year;
    private final List<String> authors;
    private final Map<String, Object> metadata;
    private final Double rawScore;

    public Item(
        String id,
        String title,
        String snippet,
        Integer year,
        List<String> authors,
        Map<String, Object> metadata,
        Double rawScore
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.snippet = snippet;
        this.year = year;
        this.authors = authors == null ? List.of() : List.copyOf(authors);
        this.metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.rawScore = rawScore;
    }

    public static Item of(String id, String title) {
        return new Item(id, title, null, null, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getSnippet() {
        return snippet;
    }

    public Integer getYear() {
        return year;
    }

    public List<String> getAuthors() {
        return authors;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Double getRawScore() {
        return rawScore;
    }
}
