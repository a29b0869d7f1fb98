package com.psl.orchestrator.query;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured parameters attached to a query, either supplied by the caller or extracted from the text.
 */
public final class QueryParams {
    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2099;

    private static final Logger log = LoggerFactory.getLogger(QueryParams.class);
    private static final QueryParams EMPTY = new QueryParams(null, null, null, null, null, null);

    private final String paperId;
    private final String author;
    private final String concept;
    private final Integer startYear;
    private final Integer endYear;
    private final String field;

    private QueryParams(
        String paperId,
        String author,
        String concept,
        Integer startYear,
        Integer endYear,
        String field
    ) {
        this.paperId = paperId;
        this.author = author;
        this.concept = concept;
        this.startYear = startYear;
        this.endYear = endYear;
        this.field = field;
    }

    public static QueryParams empty() {
        return EMPTY;
    }

    /**
     * Builds a parameter set, dropping values that fail validation instead of rejecting the query.
     */
    public static QueryParams of(
        String paperId,
        String author,
        String concept,
        Integer startYear,
        Integer endYear,
        String field
    ) {
        Integer start = validYear(startYear, "start_year");
        Integer end = validYear(endYear, "end_year");
        if (start != null && end != null && start > end) {
            log.debug("Dropping inverted year range {}-{}", start, end);
            start = null;
            end = null;
        }
        return new QueryParams(
            blankToNull(paperId),
            blankToNull(author),
            blankToNull(concept),
            start,
            end,
            blankToNull(field)
        );
    }

    public QueryParams withPaperId(String value) {
        return of(value, author, concept, startYear, endYear, field);
    }

    public QueryParams withAuthor(String value) {
        return of(paperId, value, concept, startYear, endYear, field);
    }

    public QueryParams withConcept(String value) {
        return of(paperId, author, value, startYear, endYear, field);
    }

    public QueryParams withYears(Integer start, Integer end) {
        return of(paperId, author, concept, start, end, field);
    }

    /**
     * Fields set on this instance win; gaps are filled from {@code fallback}.
     */
    public QueryParams orElse(QueryParams fallback) {
        if (fallback == null) {
            return this;
        }
        boolean ownYears = startYear != null || endYear != null;
        return of(
            paperId != null ? paperId : fallback.paperId,
            author != null ? author : fallback.author,
            concept != null ? concept : fallback.concept,
            ownYears ? startYear : fallback.startYear,
            ownYears ? endYear : fallback.endYear,
            field != null ? field : fallback.field
        );
    }

    public boolean isEmpty() {
        return paperId == null && author == null && concept == null
            && startYear == null && endYear == null && field == null;
    }

    public String getPaperId() {
        return paperId;
    }

    public String getAuthor() {
        return author;
    }

    public String getConcept() {
        return concept;
    }

    public Integer getStartYear() {
        return startYear;
    }

    public Integer getEndYear() {
        return endYear;
    }

    public String getField() {
        return field;
    }

    public boolean hasYearRange() {
        return startYear != null && endYear != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "paper_id", paperId);
        putIfPresent(map, "author", author);
        putIfPresent(map, "concept", concept);
        putIfPresent(map, "start_year", startYear);
        putIfPresent(map, "end_year", endYear);
        putIfPresent(map, "field", field);
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof QueryParams)) {
            return false;
        }
        return toMap().equals(((QueryParams) other).toMap());
    }

    @Override
    public int hashCode() {
        return toMap().hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }

    private static Integer validYear(Integer year, String name) {
        if (year == null) {
            return null;
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            log.debug("Dropping malformed {}={}", name, year);
            return null;
        }
        return year;
    }

    private static String blankToNull(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
