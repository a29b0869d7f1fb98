package com.psl.orchestrator.backend;

import com.psl.orchestrator.plan.Backend;
import java.util.List;

/**
 * Ranked items returned by one backend call. Item ranks are 1-based positions in {@link #getItems()}.
 */
public class BackendResult {
    private final Backend backend;
    private final List<Item> items;
    private final boolean error;
    private final boolean timedOut;
    private final boolean skipped;
    private final long startedAtNanos;
    private final long finishedAtNanos;
    private final String errorMessage;

    private BackendResult(
        Backend backend,
        List<Item> items,
        boolean error,
        boolean timedOut,
        boolean skipped,
        long startedAtNanos,
        long finishedAtNanos,
        String errorMessage
    ) {
        this.backend = backend;
        this.items = items == null ? List.of() : List.copyOf(items);
        this.error = error;
        this.timedOut = timedOut;
        this.skipped = skipped;
        this.startedAtNanos = startedAtNanos;
        this.finishedAtNanos = finishedAtNanos;
        this.errorMessage = errorMessage;
    }

    public static BackendResult success(Backend backend, List<Item> items, long startedAtNanos, long finishedAtNanos) {
        return new BackendResult(backend, items, false, false, false, startedAtNanos, finishedAtNanos, null);
    }

    public static BackendResult error(Backend backend, String message, long startedAtNanos, long finishedAtNanos) {
        return new BackendResult(backend, List.of(), true, false, false, startedAtNanos, finishedAtNanos, message);
    }

    public static BackendResult timedOut(Backend backend, long startedAtNanos) {
        return new BackendResult(backend, List.of(), true, true, false, startedAtNanos, System.nanoTime(), "timeout");
    }

    public static BackendResult skipped(Backend backend, String reason) {
        long now = System.nanoTime();
        return new BackendResult(backend, List.of(), true, false, true, now, now, reason);
    }

    public Backend getBackend() {
        return backend;
    }

    public List<Item> getItems() {
        return items;
    }

    public int rankOf(int index) {
        return index + 1;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public long getStartedAtNanos() {
        return startedAtNanos;
    }

    public long getFinishedAtNanos() {
        return finishedAtNanos;
    }

    public long getTookMs() {
        return Math.max(0L, (finishedAtNanos - startedAtNanos) / 1_000_000L);
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
