package com.psl.orchestrator.intent;

import com.psl.orchestrator.query.QueryParams;

@FunctionalInterface
public interface ParameterExtractor {
    QueryParams extract(String text);

    static ParameterExtractor none() {
        return text -> QueryParams.empty();
    }

    default ParameterExtractor and(ParameterExtractor other) {
        return text -> extract(text).orElse(other.extract(text));
    }
}
