package com.psl.orchestrator.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public final class ClassificationRule<T> {
    private final T label;
    private final double confidence;
    private final List<Pattern> patterns;
    private final ParameterExtractor extractor;

    private ClassificationRule(T label, double confidence, List<Pattern> patterns, ParameterExtractor extractor) {
        this.label = Objects.requireNonNull(label, "label");
        this.confidence = confidence;
        this.patterns = List.copyOf(patterns);
        this.extractor = extractor == null ? ParameterExtractor.none() : extractor;
    }

    public static <T> Builder<T> of(T label, double confidence) {
        return new Builder<>(label, confidence);
    }

    public T getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public ParameterExtractor getExtractor() {
        return extractor;
    }

    /**
     * Returns the first pattern that finds a match, or null.
     */
    public Pattern match(String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return pattern;
            }
        }
        return null;
    }

    public static final class Builder<T> {
        private final T label;
        private final double confidence;
        private final List<Pattern> patterns = new ArrayList<>();
        private ParameterExtractor extractor;

        private Builder(T label, double confidence) {
            this.label = label;
            this.confidence = confidence;
        }

        public Builder<T> anyCase(String... regexes) {
            for (String regex : regexes) {
                patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
            }
            return this;
        }

        public Builder<T> exactCase(String... regexes) {
            for (String regex : regexes) {
                patterns.add(Pattern.compile(regex));
            }
            return this;
        }

        public Builder<T> extracting(ParameterExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public ClassificationRule<T> build() {
            if (patterns.isEmpty()) {
                throw new IllegalStateException("rule for " + label + " has no patterns");
            }
            return new ClassificationRule<>(label, confidence, patterns, extractor);
        }
    }
}
