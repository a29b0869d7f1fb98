package com.psl.orchestrator.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Appends related domain terms to short, vague queries so that semantic search casts a wider net.
 */
@Component
public class QueryExpander {
    static final int MAX_WORDS = 4;
    static final int MAX_EXPANSIONS_PER_TERM = 2;

    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

    private static final List<String> OPERATORS = List.of("\"", "AND", "OR", "NOT", "(", ")");

    // Iteration order decides the order of appended terms.
    private static final Map<String, List<String>> TERMS = termTable();

    private static Map<String, List<String>> termTable() {
        Map<String, List<String>> terms = new LinkedHashMap<>();
        terms.put("attention", List.of("attentional control", "selective attention", "sustained attention", "divided attention"));
        terms.put("memory", List.of("working memory", "episodic memory", "semantic memory", "memory consolidation"));
        terms.put("executive function", List.of("cognitive control", "inhibitory control", "set shifting", "working memory"));
        terms.put("cognitive control", List.of("executive function", "inhibitory control", "attention regulation", "top-down control"));
        terms.put("dissociation", List.of("depersonalization", "derealization", "dissociative experiences", "altered states"));
        terms.put("trauma", List.of("PTSD", "post-traumatic stress", "traumatic stress", "trauma exposure"));
        terms.put("anxiety", List.of("anxious arousal", "worry", "fear response", "threat detection"));
        terms.put("depression", List.of("depressive symptoms", "mood disorder", "anhedonia", "dysphoria"));
        terms.put("prefrontal", List.of("prefrontal cortex", "PFC", "dorsolateral prefrontal", "ventromedial prefrontal"));
        terms.put("amygdala", List.of("amygdalar", "threat processing", "fear conditioning", "emotional learning"));
        terms.put("hippocampus", List.of("hippocampal", "memory formation", "spatial memory", "pattern separation"));
        terms.put("fmri", List.of("functional MRI", "neuroimaging", "brain imaging", "BOLD signal"));
        terms.put("eeg", List.of("electroencephalography", "event-related potentials", "ERP", "neural oscillations"));
        terms.put("behavioral", List.of("task performance", "reaction time", "accuracy", "experimental paradigm"));
        return Collections.unmodifiableMap(terms);
    }

    public boolean shouldExpand(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String query = text.trim();
        if (query.split("\\s+").length > MAX_WORDS) {
            return false;
        }
        for (String operator : OPERATORS) {
            if (query.contains(operator)) {
                return false;
            }
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return TERMS.keySet().stream().anyMatch(lower::contains);
    }

    /**
     * Returns the expanded text, or empty when the query is specific enough or no term matches.
     */
    public Optional<String> expand(String text) {
        if (!shouldExpand(text)) {
            return Optional.empty();
        }
        String query = text.trim();
        String lower = query.toLowerCase(Locale.ROOT);
        List<String> added = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : TERMS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                List<String> related = entry.getValue();
                added.addAll(related.subList(0, Math.min(MAX_EXPANSIONS_PER_TERM, related.size())));
            }
        }
        String expanded = query + " " + String.join(" ", added);
        log.debug("Expanded '{}' with {}", query, added);
        return Optional.of(expanded);
    }
}
