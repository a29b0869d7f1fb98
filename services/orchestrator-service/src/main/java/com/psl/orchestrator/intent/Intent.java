package com.psl.orchestrator.intent;

import com.psl.orchestrator.backend.graph.GraphStrategy;
import java.util.Locale;

public enum Intent {
    RELATIONSHIP("relationship", false, GraphStrategy.COMPREHENSIVE),
    METADATA("metadata", false, GraphStrategy.COMPREHENSIVE),
    SEMANTIC("semantic", true, GraphStrategy.COMPREHENSIVE),
    CITATION("citation", false, GraphStrategy.CITATION_CHAIN),
    INFLUENCE("influence", false, GraphStrategy.INFLUENCE),
    CONTENT_SIMILARITY("content_similarity", false, GraphStrategy.CONTENT_SIMILARITY),
    COLLABORATION("collaboration", false, GraphStrategy.COLLABORATION),
    CONCEPT_NETWORK("concept_network", false, GraphStrategy.CONCEPT_NETWORK),
    TEMPORAL("temporal", false, GraphStrategy.TEMPORAL),
    VENUE("venue", false, GraphStrategy.VENUE),
    COMPREHENSIVE("comprehensive", false, GraphStrategy.COMPREHENSIVE);

    private final String wireName;
    private final boolean decomposable;
    private final GraphStrategy graphStrategy;

    Intent(String wireName, boolean decomposable, GraphStrategy graphStrategy) {
        this.wireName = wireName;
        this.decomposable = decomposable;
        this.graphStrategy = graphStrategy;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Relational intents keep their conjunctions ("worked with", "between X and Y") intact.
     */
    public boolean isDecomposable() {
        return decomposable;
    }

    public GraphStrategy graphStrategy() {
        return graphStrategy;
    }

    public static Intent fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (Intent intent : values()) {
            if (intent.wireName.equals(normalized)) {
                return intent;
            }
        }
        return null;
    }
}
