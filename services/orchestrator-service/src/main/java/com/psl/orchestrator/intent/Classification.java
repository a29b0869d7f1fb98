package com.psl.orchestrator.intent;

import com.psl.orchestrator.query.QueryParams;
import java.util.Objects;

public final class Classification<T> {
    private final T label;
    private final double confidence;
    private final QueryParams params;
    private final boolean fallback;

    public Classification(T label, double confidence, QueryParams params, boolean fallback) {
        this.label = Objects.requireNonNull(label, "label");
        this.confidence = confidence;
        this.params = params == null ? QueryParams.empty() : params;
        this.fallback = fallback;
    }

    public static <T> Classification<T> forced(T label, QueryParams params) {
        return new Classification<>(label, 1.0, params, false);
    }

    public T getLabel() {
        return label;
    }

    public double getConfidence() {
        return confidence;
    }

    public QueryParams getParams() {
        return params;
    }

    public boolean isFallback() {
        return fallback;
    }

    public Classification<T> withParams(QueryParams params) {
        return new Classification<>(label, confidence, params, fallback);
    }

    @Override
    public String toString() {
        return label + "(" + confidence + ")";
    }
}
