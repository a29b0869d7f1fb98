package com.psl.orchestrator.intent;

import com.psl.orchestrator.query.QueryParams;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered rule list; the first rule with a matching pattern decides the label and its confidence.
 */
public class PatternClassifier<T> {
    private static final Logger log = LoggerFactory.getLogger(PatternClassifier.class);

    private final String name;
    private final List<ClassificationRule<T>> rules;
    private final T fallbackLabel;
    private final double fallbackConfidence;

    public PatternClassifier(
        String name,
        List<ClassificationRule<T>> rules,
        T fallbackLabel,
        double fallbackConfidence
    ) {
        this.name = name;
        this.rules = List.copyOf(rules);
        this.fallbackLabel = fallbackLabel;
        this.fallbackConfidence = fallbackConfidence;
    }

    public Classification<T> classify(String text) {
        String input = text == null ? "" : text;
        for (ClassificationRule<T> rule : rules) {
            Pattern matched = rule.match(input);
            if (matched != null) {
                QueryParams params = rule.getExtractor().extract(input);
                log.debug("{} rule {} matched '{}' via {}", name, rule.getLabel(), input, matched.pattern());
                return new Classification<>(rule.getLabel(), rule.getConfidence(), params, false);
            }
        }
        log.debug("{} fell back to {} for '{}'", name, fallbackLabel, input);
        return new Classification<>(fallbackLabel, fallbackConfidence, QueryParams.empty(), true);
    }

    public List<ClassificationRule<T>> getRules() {
        return rules;
    }
}
