package com.psl.orchestrator.intent;

import com.psl.orchestrator.query.QueryParams;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex extractors for the structured parameters embedded in free-text queries.
 */
public final class TextParameters {
    private static final String PARTICLE = "(?:van|von|der|den|de|da|del|di|du|le|la)";
    private static final String NAME_WORD = "[A-Z][a-zA-Z'\\-]+";
    private static final String NAME = "(?:" + PARTICLE + "\\s+)*" + NAME_WORD
        + "(?:\\s+(?:" + PARTICLE + "\\s+)*" + NAME_WORD + ")*";

    static final String AUTHOR_NAME = NAME;

    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");
    private static final Pattern AUTHOR = Pattern.compile("\\b(?:with|of|by|for)\\s+(" + NAME + ")");
    private static final Pattern AUTHOR_LABEL = Pattern.compile("\\bauthor:\\s*(" + NAME + ")");
    private static final Pattern POSSESSIVE_AUTHOR = Pattern.compile(
        "\\b(" + NAME_WORD + ")'s\\s+(?:work|papers|research|study|studies)\\b"
    );
    private static final Pattern EVOLVING_CONCEPT = Pattern.compile(
        "\\b(?:of|on|about|for)\\s+([a-zA-Z\\s]{3,30}?)\\s+"
            + "(?:evolv|chang|develop|progress|emerg|from|since|over|between)"
    );
    private static final Pattern NETWORK_CONCEPT = Pattern.compile("\\b(?:to|of|around|for)\\s+([a-zA-Z\\s]{3,30})");
    private static final Pattern PAPER_ID = Pattern.compile("\\b(?=[A-Z0-9]*\\d)[A-Z0-9]{8}\\b");

    private TextParameters() {
    }

    public static List<Integer> years(String text) {
        List<Integer> years = new ArrayList<>();
        if (text == null) {
            return years;
        }
        Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            years.add(Integer.parseInt(matcher.group()));
        }
        return years;
    }

    /**
     * A single year yields a one-year range; several years span from the smallest to the largest.
     */
    public static QueryParams yearRange(String text) {
        List<Integer> years = years(text);
        if (years.isEmpty()) {
            return QueryParams.empty();
        }
        int start = years.stream().mapToInt(Integer::intValue).min().getAsInt();
        int end = years.stream().mapToInt(Integer::intValue).max().getAsInt();
        return QueryParams.empty().withYears(start, end);
    }

    public static String author(String text) {
        if (text == null) {
            return null;
        }
        String found = firstGroup(AUTHOR_LABEL, text);
        if (found == null) {
            found = firstGroup(AUTHOR, text);
        }
        if (found == null) {
            found = firstGroup(POSSESSIVE_AUTHOR, text);
        }
        return found;
    }

    public static String evolvingConcept(String text) {
        return text == null ? null : firstGroup(EVOLVING_CONCEPT, text);
    }

    public static String networkConcept(String text) {
        return text == null ? null : firstGroup(NETWORK_CONCEPT, text);
    }

    public static String paperId(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = PAPER_ID.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    static ParameterExtractor authorExtractor() {
        return text -> QueryParams.empty().withAuthor(author(text));
    }

    static ParameterExtractor paperIdExtractor() {
        return text -> QueryParams.empty().withPaperId(paperId(text));
    }

    static ParameterExtractor yearExtractor() {
        return TextParameters::yearRange;
    }

    static ParameterExtractor evolvingConceptExtractor() {
        return text -> QueryParams.empty().withConcept(evolvingConcept(text));
    }

    static ParameterExtractor networkConceptExtractor() {
        return text -> QueryParams.empty().withConcept(networkConcept(text));
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
