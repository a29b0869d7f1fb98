package com.psl.orchestrator.plan;

import java.util.Locale;

public enum ExecutionStrategy {
    PARALLEL,
    SEQUENTIAL;

    /**
     * Three or more backends run one at a time; each may hold a large model in memory.
     */
    public static ExecutionStrategy forBackendCount(int backendCount) {
        return backendCount >= 3 ? SEQUENTIAL : PARALLEL;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
