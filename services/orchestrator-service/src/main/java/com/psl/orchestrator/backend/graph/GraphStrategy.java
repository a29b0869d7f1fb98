package com.psl.orchestrator.backend.graph;

import com.psl.orchestrator.query.QueryParams;
import java.util.Locale;

public enum GraphStrategy {
    CITATION_CHAIN("citation"),
    INFLUENCE("influence"),
    CONTENT_SIMILARITY("content_similarity"),
    RELATED("related"),
    COLLABORATION("collaboration"),
    CONCEPT_NETWORK("concept"),
    TEMPORAL("temporal"),
    VENUE("venue"),
    COMPREHENSIVE("comprehensive");

    private final String wireName;

    GraphStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Name of the first required parameter absent from {@code params}, or null when the strategy can run.
     */
    public String missingParameter(QueryParams params) {
        QueryParams p = params == null ? QueryParams.empty() : params;
        switch (this) {
            case CITATION_CHAIN:
            case CONTENT_SIMILARITY:
            case RELATED:
                return p.getPaperId() == null ? "paper_id" : null;
            case COLLABORATION:
                return p.getAuthor() == null ? "author" : null;
            case CONCEPT_NETWORK:
                return p.getConcept() == null ? "concept" : null;
            case TEMPORAL:
                if (p.getConcept() == null) {
                    return "concept";
                }
                return p.hasYearRange() ? null : "start_year/end_year";
            default:
                return null;
        }
    }

    public boolean isSatisfiedBy(QueryParams params) {
        return missingParameter(params) == null;
    }

    public static GraphStrategy fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (normalized.isEmpty()) {
            return null;
        }
        for (GraphStrategy strategy : values()) {
            if (strategy.wireName.equals(normalized) || strategy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return strategy;
            }
        }
        if ("exploratory".equals(normalized)) {
            return COMPREHENSIVE;
        }
        return null;
    }
}
