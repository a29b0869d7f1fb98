package com.psl.orchestrator.intent;

import static com.psl.orchestrator.intent.TextParameters.authorExtractor;
import static com.psl.orchestrator.intent.TextParameters.evolvingConceptExtractor;
import static com.psl.orchestrator.intent.TextParameters.networkConceptExtractor;
import static com.psl.orchestrator.intent.TextParameters.paperIdExtractor;
import static com.psl.orchestrator.intent.TextParameters.yearExtractor;

import com.psl.orchestrator.query.QueryParams;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class IntentClassifier {
    public static final String FORCE_FAST = "fast";
    public static final String FORCE_COMPREHENSIVE = "comprehensive";

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    static final List<ClassificationRule<Intent>> RULES = List.of(
        ClassificationRule.of(Intent.CITATION, 0.90)
            .anyCase(QueryPatterns.CITATION)
            .extracting(paperIdExtractor())
            .build(),
        ClassificationRule.of(Intent.INFLUENCE, 0.90)
            .anyCase(QueryPatterns.INFLUENCE)
            .build(),
        ClassificationRule.of(Intent.CONTENT_SIMILARITY, 0.85)
            .anyCase(QueryPatterns.CONTENT_SIMILARITY)
            .exactCase(QueryPatterns.SIMILAR_TO_PAPER_ID)
            .extracting(paperIdExtractor())
            .build(),
        ClassificationRule.of(Intent.COLLABORATION, 0.90)
            .anyCase(QueryPatterns.COLLABORATION)
            .extracting(authorExtractor())
            .build(),
        ClassificationRule.of(Intent.TEMPORAL, 0.85)
            .anyCase(QueryPatterns.TEMPORAL)
            .extracting(yearExtractor().and(evolvingConceptExtractor()))
            .build(),
        ClassificationRule.of(Intent.CONCEPT_NETWORK, 0.85)
            .anyCase(QueryPatterns.CONCEPT_NETWORK)
            .extracting(networkConceptExtractor())
            .build(),
        ClassificationRule.of(Intent.VENUE, 0.80)
            .anyCase(QueryPatterns.VENUE)
            .build(),
        ClassificationRule.of(Intent.RELATIONSHIP, 0.90)
            .anyCase(
                "\\b(citation|cited|citing|cites)\\b",
                "\\b(network|connection|related to)\\b",
                "\\b(who worked with|influenced by|builds on)\\b",
                "\\b(relationship between|links between)\\b",
                "\\bwho\\s+(has\\s+)?(studied|researched|worked|wrote|published|examined|investigated|explored)\\b",
                "\\b(which|what)\\s+(authors|researchers|scientists|scholars)\\b",
                "\\b(researchers|authors|scholars)\\s+(working|focusing|studying)\\s+on\\b"
            )
            .extracting(authorExtractor().and(paperIdExtractor()))
            .build(),
        ClassificationRule.of(Intent.METADATA, 0.80)
            .exactCase(
                "\\bby\\s+" + TextParameters.AUTHOR_NAME + "\\b",
                "\\b[A-Z][a-zA-Z'\\-]+'s\\s+(work|papers|research|study|studies)\\b",
                "\\bpublished in\\s+\\d{4}\\b",
                "\\bpublished in\\s+[A-Z]",
                "\\bin\\s+\\d{4}\\b",
                "\\bfrom\\s+\\d{4}\\b",
                "\\bauthor:\\s*[A-Za-z]"
            )
            .extracting(authorExtractor().and(yearExtractor()))
            .build()
    );

    private final PatternClassifier<Intent> classifier =
        new PatternClassifier<>("intent", RULES, Intent.SEMANTIC, 0.70);

    public Classification<Intent> classify(String text) {
        return classifier.classify(text);
    }

    /**
     * Honors a forced mode when it names a known intent; otherwise classifies the text.
     */
    public Classification<Intent> classify(String text, String forceMode) {
        Intent forced = resolveForcedMode(forceMode);
        if (forced == null) {
            if (forceMode != null && !forceMode.isBlank()) {
                log.debug("Ignoring unknown forced mode '{}'", forceMode);
            }
            return classify(text);
        }
        return Classification.forced(forced, extractFor(forced, text));
    }

    public static Intent resolveForcedMode(String forceMode) {
        if (forceMode == null || forceMode.isBlank()) {
            return null;
        }
        String normalized = forceMode.trim().toLowerCase(Locale.ROOT);
        if (FORCE_FAST.equals(normalized)) {
            return Intent.SEMANTIC;
        }
        if (FORCE_COMPREHENSIVE.equals(normalized)) {
            return Intent.COMPREHENSIVE;
        }
        return Intent.fromString(normalized);
    }

    private static QueryParams extractFor(Intent intent, String text) {
        String input = text == null ? "" : text;
        for (ClassificationRule<Intent> rule : RULES) {
            if (rule.getLabel() == intent) {
                return rule.getExtractor().extract(input);
            }
        }
        return QueryParams.empty();
    }
}
