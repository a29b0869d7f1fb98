package com.psl.orchestrator.intent;

import static org.assertj.core.api.Assertions.assertThat;

import com.psl.orchestrator.backend.graph.GraphStrategy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExplorationClassifierTest {

    private final ExplorationClassifier classifier = new ExplorationClassifier();

    @Test
    void similarityIsCheckedBeforeRelated() {
        assertThat(classifier.classify("find papers similar to ABC12345").getLabel())
            .isEqualTo(GraphStrategy.CONTENT_SIMILARITY);

        Classification<GraphStrategy> related = classifier.classify("papers related to ABC12345");
        assertThat(related.getLabel()).isEqualTo(GraphStrategy.RELATED);
        assertThat(related.getConfidence()).isEqualTo(0.75);
        assertThat(related.getParams().getPaperId()).isEqualTo("ABC12345");
    }

    @Test
    void sharedPhrasingPicksTheMatchingSearchIntent() {
        IntentClassifier intents = new IntentClassifier();
        Map<String, GraphStrategy> phrases = new LinkedHashMap<>();
        phrases.put("papers citing ABC12345", GraphStrategy.CITATION_CHAIN);
        phrases.put("most influential work on attachment", GraphStrategy.INFLUENCE);
        phrases.put("more like this study", GraphStrategy.CONTENT_SIMILARITY);
        phrases.put("who collaborated with Spiegel", GraphStrategy.COLLABORATION);
        phrases.put("track dissociation research over time", GraphStrategy.TEMPORAL);
        phrases.put("concepts related to dissociation", GraphStrategy.CONCEPT_NETWORK);
        phrases.put("journal patterns for trauma", GraphStrategy.VENUE);

        phrases.forEach((phrase, strategy) -> {
            assertThat(classifier.classify(phrase).getLabel()).as(phrase).isEqualTo(strategy);
            assertThat(intents.classify(phrase).getLabel().graphStrategy()).as(phrase).isEqualTo(strategy);
        });
    }

    @Test
    void vagueQueryFallsBackToComprehensive() {
        Classification<GraphStrategy> result = classifier.classify("tell me about the library");

        assertThat(result.getLabel()).isEqualTo(GraphStrategy.COMPREHENSIVE);
        assertThat(result.getConfidence()).isEqualTo(0.60);
    }

    @Test
    void forcedStrategyStillExtractsParameters() {
        Classification<GraphStrategy> result = classifier.classify("start from ABC12345", "citation");

        assertThat(result.getLabel()).isEqualTo(GraphStrategy.CITATION_CHAIN);
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getParams().getPaperId()).isEqualTo("ABC12345");
    }
}
