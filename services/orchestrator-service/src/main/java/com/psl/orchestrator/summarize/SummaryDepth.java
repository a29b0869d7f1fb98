package com.psl.orchestrator.summarize;

import java.util.Locale;

public enum SummaryDepth {
    QUICK,
    TARGETED,
    COMPREHENSIVE,
    FULL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SummaryDepth fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SummaryDepth depth : values()) {
            if (depth.name().equals(normalized)) {
                return depth;
            }
        }
        return null;
    }
}
