package com.psl.orchestrator.merge;

import com.psl.orchestrator.plan.Backend;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fused ranking; entries are ordered by descending score and each identifier occurs once.
 */
public final class FusedResult {
    private static final FusedResult EMPTY = new FusedResult(List.of());

    private final List<FusedEntry> entries;
    private final Map<String, FusedEntry> byId;

    FusedResult(List<FusedEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, FusedEntry> index = new LinkedHashMap<>();
        for (FusedEntry entry : this.entries) {
            if (index.put(entry.getId(), entry) != null) {
                throw new IllegalStateException("duplicate fused identifier " + entry.getId());
            }
        }
        this.byId = index;
    }

    public static FusedResult empty() {
        return EMPTY;
    }

    public List<FusedEntry> getEntries() {
        return entries;
    }

    public Optional<FusedEntry> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<FusedEntry> top(int limit) {
        if (limit >= entries.size()) {
            return entries;
        }
        return entries.subList(0, Math.max(0, limit));
    }

    /**
     * Backends that contributed at least one entry, in first-contribution order.
     */
    public List<Backend> contributingBackends() {
        Set<Backend> backends = new LinkedHashSet<>();
        for (FusedEntry entry : entries) {
            backends.addAll(entry.getBackends());
        }
        return new ArrayList<>(backends);
    }
}
