package com.psl.orchestrator.execution;

import java.util.concurrent.TimeUnit;

/**
 * Wall-clock budget shared by every wait in one orchestration pass.
 */
public final class Deadline {
    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, false);

    private final long expiresAtNanos;
    private final boolean bounded;

    private Deadline(long expiresAtNanos, boolean bounded) {
        this.expiresAtNanos = expiresAtNanos;
        this.bounded = bounded;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline afterMs(Integer timeoutMs) {
        if (timeoutMs == null || timeoutMs <= 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs), true);
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() >= expiresAtNanos;
    }

    /**
     * Remaining milliseconds, null when unbounded, never negative.
     */
    public Integer remainingMs() {
        if (!bounded) {
            return null;
        }
        long remaining = TimeUnit.NANOSECONDS.toMillis(expiresAtNanos - System.nanoTime());
        return (int) Math.max(0L, Math.min(Integer.MAX_VALUE, remaining));
    }
}
