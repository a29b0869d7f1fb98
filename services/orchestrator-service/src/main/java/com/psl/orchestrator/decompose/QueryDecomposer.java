package com.psl.orchestrator.decompose;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueryDecomposer {
    static final double REQUIRED_WEIGHT = 1.0;
    static final double OPTIONAL_WEIGHT = 0.7;
    static final double PREPOSITION_WEIGHT = 0.6;
    static final double COMMA_WEIGHT = 0.5;
    static final double NOUN_PHRASE_WEIGHT = 0.4;
    static final int MAX_NOUN_PHRASES = 3;

    private static final Logger log = LoggerFactory.getLogger(QueryDecomposer.class);

    private static final Pattern UPPER_AND = Pattern.compile("\\bAND\\b");
    private static final Pattern UPPER_OR = Pattern.compile("\\bOR\\b");
    private static final Pattern NATURAL_AND = Pattern.compile("\\b(?:and|with|plus)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NATURAL_OR = Pattern.compile("\\b(?:or|versus|vs)\\b\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PREPOSITION = Pattern.compile(
        "^(.+?)\\b(?:in|about|regarding|concerning|for|during|with respect to)\\b(.+)$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NOUN_PHRASE = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b");

    // Segments made only of these words carry no topic of their own.
    private static final Set<String> GENERIC_WORDS = Set.of(
        "a", "an", "the", "find", "show", "search", "list", "get", "me", "some", "any", "all",
        "paper", "papers", "article", "articles", "research", "studies", "study", "work", "works",
        "literature", "publications", "what", "which", "is", "are", "known", "recent"
    );

    public List<SubQuery> decompose(String text) {
        String query = text == null ? "" : text.trim();
        if (query.isEmpty()) {
            return List.of();
        }
        List<SubQuery> result = explicitOperators(query);
        if (result == null) {
            result = splitOn(query, NATURAL_AND, REQUIRED_WEIGHT, SubQuery.Role.REQUIRED);
        }
        if (result == null) {
            result = splitOn(query, NATURAL_OR, OPTIONAL_WEIGHT, SubQuery.Role.OPTIONAL);
        }
        if (result == null) {
            result = commaList(query);
        }
        if (result == null) {
            result = prepositional(query);
        }
        if (result == null) {
            result = nounPhrases(query);
        }
        return finish(query, result);
    }

    /**
     * Splits only on upper-case {@code AND}/{@code OR}. These are honoured whatever the query's intent.
     */
    public List<SubQuery> decomposeExplicit(String text) {
        String query = text == null ? "" : text.trim();
        if (query.isEmpty()) {
            return List.of();
        }
        return finish(query, explicitOperators(query));
    }

    private List<SubQuery> explicitOperators(String query) {
        List<SubQuery> result = splitOn(query, UPPER_AND, REQUIRED_WEIGHT, SubQuery.Role.REQUIRED);
        if (result == null) {
            result = splitOn(query, UPPER_OR, OPTIONAL_WEIGHT, SubQuery.Role.OPTIONAL);
        }
        return result;
    }

    private List<SubQuery> finish(String query, List<SubQuery> result) {
        if (result == null) {
            return List.of(SubQuery.whole(query));
        }
        List<SubQuery> collapsed = collapse(result);
        if (collapsed.size() < 2) {
            return List.of(SubQuery.whole(query));
        }
        log.info("Decomposed '{}' into {} sub-queries", query, collapsed.size());
        return collapsed;
    }

    private List<SubQuery> splitOn(String query, Pattern separator, double weight, SubQuery.Role role) {
        if (!separator.matcher(query).find()) {
            return null;
        }
        List<SubQuery> parts = new ArrayList<>();
        for (String part : separator.split(query)) {
            if (isTopical(part)) {
                parts.add(new SubQuery(part, weight, role));
            }
        }
        return parts.size() >= 2 ? parts : null;
    }

    private List<SubQuery> commaList(String query) {
        if (query.indexOf(',') < 0) {
            return null;
        }
        List<SubQuery> parts = new ArrayList<>();
        for (String part : query.split(",")) {
            if (isTopical(part)) {
                parts.add(new SubQuery(part, COMMA_WEIGHT, SubQuery.Role.SUPPORTING));
            }
        }
        if (parts.size() < 2) {
            return null;
        }
        List<SubQuery> result = new ArrayList<>();
        result.add(SubQuery.whole(query));
        result.addAll(parts);
        return result;
    }

    private List<SubQuery> prepositional(String query) {
        Matcher matcher = PREPOSITION.matcher(query);
        if (!matcher.matches()) {
            return null;
        }
        String head = matcher.group(1);
        String tail = matcher.group(2);
        if (!isTopical(head) || !isTopical(tail)) {
            return null;
        }
        List<SubQuery> result = new ArrayList<>();
        result.add(SubQuery.whole(query));
        result.add(new SubQuery(head, PREPOSITION_WEIGHT, SubQuery.Role.SUPPORTING));
        result.add(new SubQuery(tail, PREPOSITION_WEIGHT, SubQuery.Role.SUPPORTING));
        return result;
    }

    private List<SubQuery> nounPhrases(String query) {
        Matcher matcher = NOUN_PHRASE.matcher(query);
        List<String> phrases = new ArrayList<>();
        while (matcher.find()) {
            phrases.add(matcher.group());
        }
        if (phrases.size() < 2) {
            return null;
        }
        List<SubQuery> result = new ArrayList<>();
        result.add(SubQuery.whole(query));
        for (String phrase : phrases.subList(0, Math.min(MAX_NOUN_PHRASES, phrases.size()))) {
            if (phrase.split("\\s+").length >= 2) {
                result.add(new SubQuery(phrase, NOUN_PHRASE_WEIGHT, SubQuery.Role.SUPPORTING));
            }
        }
        return result.size() > 1 ? result : null;
    }

    /**
     * Case-insensitive duplicates collapse into the first occurrence, keeping the highest weight.
     */
    static List<SubQuery> collapse(List<SubQuery> subQueries) {
        Map<String, SubQuery> byText = new LinkedHashMap<>();
        for (SubQuery subQuery : subQueries) {
            String key = subQuery.getText().toLowerCase(Locale.ROOT);
            SubQuery existing = byText.get(key);
            if (existing == null) {
                byText.put(key, subQuery);
            } else if (subQuery.getWeight() > existing.getWeight()) {
                byText.put(key, new SubQuery(existing.getText(), subQuery.getWeight(), subQuery.getRole()));
            }
        }
        return List.copyOf(byText.values());
    }

    static boolean isTopical(String segment) {
        if (segment == null || segment.isBlank()) {
            return false;
        }
        for (String word : segment.trim().toLowerCase(Locale.ROOT).split("[^a-z0-9'\\-]+")) {
            if (!word.isEmpty() && !GENERIC_WORDS.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
