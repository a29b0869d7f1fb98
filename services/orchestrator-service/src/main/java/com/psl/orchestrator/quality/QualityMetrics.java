package com.psl.orchestrator.quality;

public final class QualityMetrics {
    private final ConfidenceTier tier;
    private final double confidenceScore;
    private final double coverage;
    private final boolean escalationRecommended;

    public QualityMetrics(ConfidenceTier tier, double confidenceScore, double coverage, boolean escalationRecommended) {
        this.tier = tier;
        this.confidenceScore = confidenceScore;
        this.coverage = coverage;
        this.escalationRecommended = escalationRecommended;
    }

    public ConfidenceTier getTier() {
        return tier;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public double getCoverage() {
        return coverage;
    }

    public boolean isEscalationRecommended() {
        return escalationRecommended;
    }

    @Override
    public String toString() {
        return tier.wireName() + "(" + confidenceScore + ", coverage=" + coverage + ")";
    }
}
