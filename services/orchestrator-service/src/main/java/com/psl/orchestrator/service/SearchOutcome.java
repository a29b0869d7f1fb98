package com.psl.orchestrator.service;

import com.psl.orchestrator.decompose.SubQuery;
import com.psl.orchestrator.intent.Intent;
import com.psl.orchestrator.merge.FusedEntry;
import com.psl.orchestrator.merge.FusedResult;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.quality.QualityMetrics;
import java.util.List;

public final class SearchOutcome {
    public static final String EXECUTION_DECOMPOSED = "decomposed";

    private final Intent intent;
    private final double confidence;
    private final List<Backend> plannedBackends;
    private final List<Backend> usedBackends;
    private final String execution;
    private final boolean escalated;
    private final boolean timedOut;
    private final QualityMetrics quality;
    private final FusedResult fused;
    private final int limit;
    private final List<SubQuery> subQueries;
    private final String expandedQuery;
    private final long tookMs;

    private SearchOutcome(Builder builder) {
        this.intent = builder.intent;
        this.confidence = builder.confidence;
        this.plannedBackends = List.copyOf(builder.plannedBackends);
        this.usedBackends = List.copyOf(builder.usedBackends);
        this.execution = builder.execution;
        this.escalated = builder.escalated;
        this.timedOut = builder.timedOut;
        this.quality = builder.quality;
        this.fused = builder.fused == null ? FusedResult.empty() : builder.fused;
        this.limit = builder.limit;
        this.subQueries = builder.subQueries == null ? List.of() : List.copyOf(builder.subQueries);
        this.expandedQuery = builder.expandedQuery;
        this.tookMs = builder.tookMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Intent getIntent() {
        return intent;
    }

    public String getMode() {
        return intent.wireName();
    }

    public double getConfidence() {
        return confidence;
    }

    public List<Backend> getPlannedBackends() {
        return plannedBackends;
    }

    public List<Backend> getUsedBackends() {
        return usedBackends;
    }

    public String getExecution() {
        return execution;
    }

    public boolean isEscalated() {
        return escalated;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public QualityMetrics getQuality() {
        return quality;
    }

    public FusedResult getFused() {
        return fused;
    }

    public List<FusedEntry> getResults() {
        return fused.top(limit);
    }

    public int getLimit() {
        return limit;
    }

    public boolean isDecomposed() {
        return !subQueries.isEmpty();
    }

    public List<SubQuery> getSubQueries() {
        return subQueries;
    }

    /**
     * The text actually searched when short vague input was expanded, otherwise {@code null}.
     */
    public String getExpandedQuery() {
        return expandedQuery;
    }

    public boolean isNoResults() {
        return fused.isEmpty();
    }

    public long getTookMs() {
        return tookMs;
    }

    public static final class Builder {
        private Intent intent = Intent.SEMANTIC;
        private double confidence;
        private List<Backend> plannedBackends = List.of();
        private List<Backend> usedBackends = List.of();
        private String execution;
        private boolean escalated;
        private boolean timedOut;
        private QualityMetrics quality;
        private FusedResult fused;
        private int limit;
        private List<SubQuery> subQueries;
        private String expandedQuery;
        private long tookMs;

        private Builder() {
        }

        public Builder intent(Intent intent, double confidence) {
            this.intent = intent;
            this.confidence = confidence;
            return this;
        }

        public Builder plannedBackends(List<Backend> plannedBackends) {
            this.plannedBackends = plannedBackends;
            return this;
        }

        public Builder usedBackends(List<Backend> usedBackends) {
            this.usedBackends = usedBackends;
            return this;
        }

        public Builder execution(String execution) {
            this.execution = execution;
            return this;
        }

        public Builder escalated(boolean escalated) {
            this.escalated = escalated;
            return this;
        }

        public Builder timedOut(boolean timedOut) {
            this.timedOut = timedOut;
            return this;
        }

        public Builder quality(QualityMetrics quality) {
            this.quality = quality;
            return this;
        }

        public Builder fused(FusedResult fused, int limit) {
            this.fused = fused;
            this.limit = limit;
            return this;
        }

        public Builder subQueries(List<SubQuery> subQueries) {
            this.subQueries = subQueries;
            return this;
        }

        public Builder expandedQuery(String expandedQuery) {
            this.expandedQuery = expandedQuery;
            return this;
        }

        public Builder tookMs(long tookMs) {
            this.tookMs = tookMs;
            return this;
        }

        public SearchOutcome build() {
            return new SearchOutcome(this);
        }
    }
}
