package com.psl.orchestrator.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the fused results of decomposed sub-queries; each entry scores the weighted sum of its sub-scores.
 */
public final class WeightedMerge {
    private WeightedMerge() {
    }

    public static FusedResult merge(List<WeightedResult> parts) {
        Map<String, RrfFusion.MutableCandidate> candidates = new LinkedHashMap<>();
        if (parts == null) {
            return FusedResult.empty();
        }
        for (WeightedResult part : parts) {
            for (FusedEntry entry : part.getResult().getEntries()) {
                RrfFusion.MutableCandidate candidate = candidates.get(entry.getId());
                if (candidate == null) {
                    candidate = new RrfFusion.MutableCandidate(entry.getItem(), candidates.size());
                    candidates.put(entry.getId(), candidate);
                }
                candidate.addScore(part.getWeight() * entry.getScore());
                candidate.addBackends(entry.getBackends());
            }
        }
        return RrfFusion.toResult(new ArrayList<>(candidates.values()));
    }

    public static final class WeightedResult {
        private final double weight;
        private final FusedResult result;

        public WeightedResult(double weight, FusedResult result) {
            this.weight = weight;
            this.result = result == null ? FusedResult.empty() : result;
        }

        public double getWeight() {
            return weight;
        }

        public FusedResult getResult() {
            return result;
        }
    }
}
