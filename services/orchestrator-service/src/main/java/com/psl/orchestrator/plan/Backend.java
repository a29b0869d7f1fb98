package com.psl.orchestrator.plan;

import java.util.List;
import java.util.Locale;

public enum Backend {
    VECTOR("vector"),
    GRAPH("graph"),
    METADATA("metadata");

    private static final List<Backend> ALL = List.of(VECTOR, GRAPH, METADATA);

    private final String wireName;

    Backend(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static List<Backend> all() {
        return ALL;
    }

    public static Backend fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Backend backend : ALL) {
            if (backend.wireName.equals(normalized)) {
                return backend;
            }
        }
        return null;
    }
}
