package com.psl.orchestrator.intent;

import static com.psl.orchestrator.intent.TextParameters.authorExtractor;
import static com.psl.orchestrator.intent.TextParameters.evolvingConceptExtractor;
import static com.psl.orchestrator.intent.TextParameters.networkConceptExtractor;
import static com.psl.orchestrator.intent.TextParameters.paperIdExtractor;
import static com.psl.orchestrator.intent.TextParameters.yearExtractor;

import com.psl.orchestrator.backend.graph.GraphStrategy;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks a graph exploration strategy. Content similarity is checked before shared-entity relations.
 */
@Component
public class ExplorationClassifier {
    static final List<ClassificationRule<GraphStrategy>> RULES = List.of(
        ClassificationRule.of(GraphStrategy.CITATION_CHAIN, 0.90)
            .anyCase(QueryPatterns.CITATION)
            .extracting(paperIdExtractor())
            .build(),
        ClassificationRule.of(GraphStrategy.INFLUENCE, 0.90)
            .anyCase(QueryPatterns.INFLUENCE)
            .build(),
        ClassificationRule.of(GraphStrategy.CONTENT_SIMILARITY, 0.85)
            .anyCase(QueryPatterns.CONTENT_SIMILARITY)
            .exactCase(QueryPatterns.SIMILAR_TO_PAPER_ID)
            .extracting(paperIdExtractor())
            .build(),
        ClassificationRule.of(GraphStrategy.COLLABORATION, 0.90)
            .anyCase(QueryPatterns.COLLABORATION)
            .extracting(authorExtractor())
            .build(),
        ClassificationRule.of(GraphStrategy.TEMPORAL, 0.85)
            .anyCase(QueryPatterns.TEMPORAL)
            .extracting(yearExtractor().and(evolvingConceptExtractor()))
            .build(),
        ClassificationRule.of(GraphStrategy.CONCEPT_NETWORK, 0.85)
            .anyCase(QueryPatterns.CONCEPT_NETWORK)
            .extracting(networkConceptExtractor())
            .build(),
        ClassificationRule.of(GraphStrategy.VENUE, 0.80)
            .anyCase(QueryPatterns.VENUE)
            .anyCase("\\b(top|best|leading)\\s+(journals?|conferences?|venues?)\\b")
            .build(),
        ClassificationRule.of(GraphStrategy.RELATED, 0.75)
            .anyCase(
                "\\b(related|connected)\\s+(papers?|to)\\b",
                "\\bpapers?\\s+(related|connected)\\s+to\\b",
                "\\bshared\\s+(entities|authors?|concepts?)\\b",
                "\\bwhat\\s+(else|other\\s+papers?)\\s+(is|are)\\s+(related|connected)\\b"
            )
            .extracting(paperIdExtractor())
            .build()
    );

    private final PatternClassifier<GraphStrategy> classifier =
        new PatternClassifier<>("exploration", RULES, GraphStrategy.COMPREHENSIVE, 0.60);

    public Classification<GraphStrategy> classify(String text) {
        return classifier.classify(text);
    }

    public Classification<GraphStrategy> classify(String text, String forceMode) {
        GraphStrategy forced = GraphStrategy.fromString(forceMode);
        if (forced == null) {
            return classify(text);
        }
        String input = text == null ? "" : text;
        for (ClassificationRule<GraphStrategy> rule : RULES) {
            if (rule.getLabel() == forced) {
                return Classification.forced(forced, rule.getExtractor().extract(input));
            }
        }
        return Classification.forced(forced, null);
    }
}
