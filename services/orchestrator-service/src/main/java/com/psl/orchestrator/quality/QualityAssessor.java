package com.psl.orchestrator.quality;

import com.psl.orchestrator.merge.FusedEntry;
import com.psl.orchestrator.merge.FusedResult;
import com.psl.orchestrator.service.OrchestrationSettings;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class QualityAssessor {
    private final OrchestrationSettings settings;

    public QualityAssessor(OrchestrationSettings settings) {
        this.settings = settings;
    }

    /**
     * A top-ranked single-backend hit scores 1/(k+1), which normalizes to 1.0.
     */
    public double normalizedScore(double fusedScore) {
        return Math.min(1.0, fusedScore * (settings.getRrfK() + 1));
    }

    public QualityMetrics assess(FusedResult result, int requestedLimit) {
        int limit = Math.max(1, requestedLimit);
        List<FusedEntry> entries = result == null ? List.of() : result.getEntries();

        int window = Math.min(settings.getConfidenceWindow(), limit);
        double confidence = 1.0;
        for (int slot = 0; slot < window; slot++) {
            double normalized = slot < entries.size() ? normalizedScore(entries.get(slot).getScore()) : 0.0;
            confidence = Math.min(confidence, normalized);
        }

        int qualified = 0;
        for (FusedEntry entry : entries) {
            if (normalizedScore(entry.getScore()) >= settings.getQualityThreshold()) {
                qualified++;
            }
        }
        double coverage = Math.min(1.0, (double) qualified / limit);

        ConfidenceTier tier = tierFor(confidence);
        boolean escalate = tier == ConfidenceTier.LOW || coverage < settings.getMinCoverage();
        return new QualityMetrics(tier, confidence, coverage, escalate);
    }

    private ConfidenceTier tierFor(double confidence) {
        if (confidence > settings.getHighConfidenceThreshold()) {
            return ConfidenceTier.HIGH;
        }
        if (confidence > settings.getMediumConfidenceThreshold()) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }
}
