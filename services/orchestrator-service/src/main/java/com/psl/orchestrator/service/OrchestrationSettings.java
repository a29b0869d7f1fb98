package com.psl.orchestrator.service;

/**
 * Immutable snapshot of the orchestrator tuning, built once from {@link OrchestrationProperties}.
 */
public final class OrchestrationSettings {
    public static final int MAX_SUB_QUERY_WORKERS = 5;

    private final int defaultLimit;
    private final int maxLimit;
    private final int rrfK;
    private final double highConfidenceThreshold;
    private final double mediumConfidenceThreshold;
    private final double qualityThreshold;
    private final double minCoverage;
    private final int confidenceWindow;
    private final boolean escalationEnabled;
    private final boolean decompositionEnabled;
    private final boolean expansionEnabled;
    private final int defaultTimeoutMs;

    private OrchestrationSettings(Builder builder) {
        this.defaultLimit = Math.max(1, builder.defaultLimit);
        this.maxLimit = Math.max(this.defaultLimit, builder.maxLimit);
        this.rrfK = Math.max(1, builder.rrfK);
        this.highConfidenceThreshold = builder.highConfidenceThreshold;
        this.mediumConfidenceThreshold = Math.min(builder.mediumConfidenceThreshold, builder.highConfidenceThreshold);
        this.qualityThreshold = builder.qualityThreshold;
        this.minCoverage = builder.minCoverage;
        this.confidenceWindow = Math.max(1, builder.confidenceWindow);
        this.escalationEnabled = builder.escalationEnabled;
        this.decompositionEnabled = builder.decompositionEnabled;
        this.expansionEnabled = builder.expansionEnabled;
        this.defaultTimeoutMs = Math.max(0, builder.defaultTimeoutMs);
    }

    public static OrchestrationSettings defaults() {
        return builder().build();
    }

    public static OrchestrationSettings from(OrchestrationProperties properties) {
        return builder()
            .defaultLimit(properties.getDefaultLimit())
            .maxLimit(properties.getMaxLimit())
            .rrfK(properties.getRrfK())
            .highConfidenceThreshold(properties.getHighConfidenceThreshold())
            .mediumConfidenceThreshold(properties.getMediumConfidenceThreshold())
            .qualityThreshold(properties.getQualityThreshold())
            .minCoverage(properties.getMinCoverage())
            .confidenceWindow(properties.getConfidenceWindow())
            .escalationEnabled(properties.isEscalationEnabled())
            .decompositionEnabled(properties.isDecompositionEnabled())
            .expansionEnabled(properties.isExpansionEnabled())
            .defaultTimeoutMs(properties.getDefaultTimeoutMs())
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int resolveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultLimit;
        }
        return Math.min(requested, maxLimit);
    }

    public Integer resolveTimeoutMs(Integer requested) {
        if (requested != null && requested > 0) {
            return requested;
        }
        return defaultTimeoutMs > 0 ? defaultTimeoutMs : null;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public int getRrfK() {
        return rrfK;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public double getMediumConfidenceThreshold() {
        return mediumConfidenceThreshold;
    }

    public double getQualityThreshold() {
        return qualityThreshold;
    }

    public double getMinCoverage() {
        return minCoverage;
    }

    public int getConfidenceWindow() {
        return confidenceWindow;
    }

    public boolean isEscalationEnabled() {
        return escalationEnabled;
    }

    public boolean isDecompositionEnabled() {
        return decompositionEnabled;
    }

    public boolean isExpansionEnabled() {
        return expansionEnabled;
    }

    public int getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public static final class Builder {
        private int defaultLimit = 10;
        private int maxLimit = 100;
        private int rrfK = 60;
        private double highConfidenceThreshold = 0.8;
        private double mediumConfidenceThreshold = 0.5;
        private double qualityThreshold = 0.5;
        private double minCoverage = 0.5;
        private int confidenceWindow = 5;
        private boolean escalationEnabled = true;
        private boolean decompositionEnabled = true;
        private boolean expansionEnabled = true;
        private int defaultTimeoutMs = 0;

        private Builder() {
        }

        public Builder defaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
            return this;
        }

        public Builder maxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
            return this;
        }

        public Builder rrfK(int rrfK) {
            this.rrfK = rrfK;
            return this;
        }

        public Builder highConfidenceThreshold(double highConfidenceThreshold) {
            this.highConfidenceThreshold = highConfidenceThreshold;
            return this;
        }

        public Builder mediumConfidenceThreshold(double mediumConfidenceThreshold) {
            this.mediumConfidenceThreshold = mediumConfidenceThreshold;
            return this;
        }

        public Builder qualityThreshold(double qualityThreshold) {
            this.qualityThreshold = qualityThreshold;
            return this;
        }

        public Builder minCoverage(double minCoverage) {
            this.minCoverage = minCoverage;
            return this;
        }

        public Builder confidenceWindow(int confidenceWindow) {
            this.confidenceWindow = confidenceWindow;
            return this;
        }

        public Builder escalationEnabled(boolean escalationEnabled) {
            this.escalationEnabled = escalationEnabled;
            return this;
        }

        public Builder decompositionEnabled(boolean decompositionEnabled) {
            this.decompositionEnabled = decompositionEnabled;
            return this;
        }

        public Builder expansionEnabled(boolean expansionEnabled) {
            this.expansionEnabled = expansionEnabled;
            return this;
        }

        public Builder defaultTimeoutMs(int defaultTimeoutMs) {
            this.defaultTimeoutMs = defaultTimeoutMs;
            return this;
        }

        public OrchestrationSettings build() {
            return new OrchestrationSettings(this);
        }
    }
}
