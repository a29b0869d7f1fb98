package com.psl.orchestrator.merge;

import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import java.util.List;

public final class FusedEntry {
    private final Item item;
    private final double score;
    private final List<Backend> backends;
    private final int rank;

    public FusedEntry(Item item, double score, List<Backend> backends, int rank) {
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("fused entry " + item.getId() + " has no contributing backend");
        }
        this.item = item;
        this.score = score;
        this.backends = List.copyOf(backends);
        this.rank = rank;
    }

    public String getId() {
        return item.getId();
    }

    public Item getItem() {
        return item;
    }

    public double getScore() {
        return score;
    }

    public List<Backend> getBackends() {
        return backends;
    }

    public int getRank() {
        return rank;
    }
}
