package com.psl.orchestrator.merge;

import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RrfFusion {
    public static final int DEFAULT_K = 60;

    private RrfFusion() {
    }

    public static FusedResult fuse(List<BackendResult> results) {
        return fuse(results, DEFAULT_K);
    }

    /**
     * Results are walked in the given order; among equal scores the identifier seen first wins.
     */
    public static FusedResult fuse(List<BackendResult> results, int k) {
        Map<String, MutableCandidate> candidates = new LinkedHashMap<>();
        if (results == null) {
            return FusedResult.empty();
        }

        for (BackendResult result : results) {
            if (result == null) {
                continue;
            }
            List<Item> items = result.getItems();
            for (int i = 0; i < items.size(); i++) {
                Item item = items.get(i);
                MutableCandidate candidate = candidates.get(item.getId());
                if (candidate == null) {
                    candidate = new MutableCandidate(item, candidates.size());
                    candidates.put(item.getId(), candidate);
                }
                int rank = result.rankOf(i);
                candidate.addScore(1.0 / (k + rank));
                candidate.backends.add(result.getBackend());
            }
        }
        return toResult(new ArrayList<>(candidates.values()));
    }

    static FusedResult toResult(List<MutableCandidate> mutable) {
        mutable.sort(
            Comparator.comparingDouble(MutableCandidate::getScore).reversed()
                .thenComparingInt(MutableCandidate::getFirstSeen)
        );

        List<FusedEntry> fused = new ArrayList<>(mutable.size());
        for (int i = 0; i < mutable.size(); i++) {
            MutableCandidate candidate = mutable.get(i);
            fused.add(new FusedEntry(candidate.item, candidate.score, new ArrayList<>(candidate.backends), i + 1));
        }
        return new FusedResult(fused);
    }

    static final class MutableCandidate {
        private final Item item;
        private final int firstSeen;
        private final Set<Backend> backends = new LinkedHashSet<>();
        private double score;

        MutableCandidate(Item item, int firstSeen) {
            this.item = item;
            this.firstSeen = firstSeen;
        }

        void addScore(double value) {
            score += value;
        }

        void addBackends(List<Backend> contributing) {
            backends.addAll(contributing);
        }

        private int getFirstSeen() {
            return firstSeen;
        }

        private double getScore() {
            return score;
        }
    }
}
