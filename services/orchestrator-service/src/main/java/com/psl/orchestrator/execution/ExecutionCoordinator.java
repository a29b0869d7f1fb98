package com.psl.orchestrator.execution;

import com.psl.orchestrator.backend.BackendAdapter;
import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.BackendRequestException;
import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.backend.BackendUnavailableException;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.plan.ExecutionPlan;
import com.psl.orchestrator.plan.ExecutionStrategy;
import com.psl.orchestrator.resilience.BackendResilienceRegistry;
import com.psl.orchestrator.resilience.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class ExecutionCoordinator {
    public static final String CIRCUIT_OPEN = "circuit_open";
    public static final String NO_ADAPTER = "no_adapter";

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final Map<Backend, BackendAdapter> adapters = new EnumMap<>(Backend.class);
    private final ExecutorService backendExecutor;
    private final BackendResilienceRegistry resilienceRegistry;
    private final MeterRegistry meterRegistry;

    public ExecutionCoordinator(
        List<BackendAdapter> adapters,
        @Qualifier("backendExecutor") ExecutorService backendExecutor,
        BackendResilienceRegistry resilienceRegistry,
        MeterRegistry meterRegistry
    ) {
        for (BackendAdapter adapter : adapters) {
            this.adapters.put(adapter.backend(), adapter);
        }
        this.backendExecutor = backendExecutor;
        this.resilienceRegistry = resilienceRegistry;
        this.meterRegistry = meterRegistry;
    }

    public List<BackendResult> execute(ExecutionPlan plan) {
        return execute(plan, Deadline.none());
    }

    /**
     * Results come back in plan order; backend failures are folded into error-tagged results.
     */
    public List<BackendResult> execute(ExecutionPlan plan, Deadline deadline) {
        if (plan == null || plan.isEmpty()) {
            return List.of();
        }
        Deadline budget = deadline == null ? Deadline.none() : deadline;
        if (plan.getStrategy() == ExecutionStrategy.SEQUENTIAL) {
            return executeSequential(plan, budget);
        }
        return executeParallel(plan, budget);
    }

    private List<BackendResult> executeParallel(ExecutionPlan plan, Deadline deadline) {
        List<Backend> backends = plan.getBackends();
        List<CompletableFuture<BackendResult>> futures = new ArrayList<>(backends.size());
        List<Long> dispatchedAt = new ArrayList<>(backends.size());
        for (Backend backend : backends) {
            dispatchedAt.add(System.nanoTime());
            futures.add(dispatch(plan, backend, deadline));
        }
        List<BackendResult> results = new ArrayList<>(backends.size());
        for (int i = 0; i < backends.size(); i++) {
            results.add(await(backends.get(i), futures.get(i), dispatchedAt.get(i), deadline));
        }
        return results;
    }

    private List<BackendResult> executeSequential(ExecutionPlan plan, Deadline deadline) {
        List<BackendResult> results = new ArrayList<>(plan.getBackends().size());
        for (Backend backend : plan.getBackends()) {
            long dispatchedAt = System.nanoTime();
            if (deadline.isExpired()) {
                recordOutcome(backend, "timeout");
                results.add(BackendResult.timedOut(backend, dispatchedAt));
                continue;
            }
            results.add(await(backend, dispatch(plan, backend, deadline), dispatchedAt, deadline));
        }
        return results;
    }

    private CompletableFuture<BackendResult> dispatch(ExecutionPlan plan, Backend backend, Deadline deadline) {
        BackendAdapter adapter = adapters.get(backend);
        if (adapter == null) {
            log.warn("No adapter registered for backend {}", backend.wireName());
            recordOutcome(backend, "skipped");
            return CompletableFuture.completedFuture(BackendResult.skipped(backend, NO_ADAPTER));
        }
        if (!resilienceRegistry.allowRequest(backend)) {
            log.warn("Skipping backend {}: circuit open", backend.wireName());
            recordOutcome(backend, "skipped");
            return CompletableFuture.completedFuture(BackendResult.skipped(backend, CIRCUIT_OPEN));
        }
        BackendCall call = plan.callFor(backend, deadline.remainingMs());
        return CompletableFuture.supplyAsync(() -> invoke(adapter, call), backendExecutor);
    }

    private BackendResult invoke(BackendAdapter adapter, BackendCall call) {
        Backend backend = adapter.backend();
        CircuitBreaker breaker = resilienceRegistry.breakerFor(backend);
        long started = System.nanoTime();
        try {
            List<Item> items = adapter.retrieve(call);
            long finished = System.nanoTime();
            breaker.recordSuccess();
            recordOutcome(backend, items == null || items.isEmpty() ? "empty" : "success");
            return BackendResult.success(backend, items, started, finished);
        } catch (BackendUnavailableException | BackendRequestException e) {
            return failure(backend, breaker, e.getMessage(), e, started);
        } catch (RuntimeException e) {
            return failure(backend, breaker, e.getClass().getSimpleName() + ": " + e.getMessage(), e, started);
        }
    }

    private BackendResult failure(Backend backend, CircuitBreaker breaker, String message, Exception e, long started) {
        long finished = System.nanoTime();
        if (breaker.recordFailure()) {
            log.warn("Circuit opened for backend {}", backend.wireName());
        }
        log.warn("Backend {} failed: {}", backend.wireName(), message, e);
        recordOutcome(backend, "error");
        return BackendResult.error(backend, message, started, finished);
    }

    private BackendResult await(
        Backend backend,
        CompletableFuture<BackendResult> future,
        long dispatchedAt,
        Deadline deadline
    ) {
        try {
            Integer remaining = deadline.remainingMs();
            if (remaining != null) {
                return future.get(remaining, TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            log.warn("Backend {} did not finish before the deadline", backend.wireName());
            recordOutcome(backend, "timeout");
            return BackendResult.timedOut(backend, dispatchedAt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Backend {} failed: {}", backend.wireName(), cause.getMessage(), cause);
            return BackendResult.error(backend, cause.getMessage(), dispatchedAt, System.nanoTime());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BackendResult.error(backend, "interrupted", dispatchedAt, System.nanoTime());
        }
    }

    private void recordOutcome(Backend backend, String outcome) {
        meterRegistry.counter("orchestrator.backend.calls", "backend", backend.wireName(), "outcome", outcome)
            .increment();
    }
}
