package com.psl.orchestrator.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.psl.orchestrator.backend.BackendAdapter;
import com.psl.orchestrator.backend.BackendCall;
import com.psl.orchestrator.backend.BackendResult;
import com.psl.orchestrator.backend.BackendUnavailableException;
import com.psl.orchestrator.backend.Item;
import com.psl.orchestrator.intent.Intent;
import com.psl.orchestrator.plan.Backend;
import com.psl.orchestrator.plan.ExecutionPlan;
import com.psl.orchestrator.plan.ExecutionStrategy;
import com.psl.orchestrator.query.QueryParams;
import com.psl.orchestrator.resilience.BackendResilienceProperties;
import com.psl.orchestrator.resilience.BackendResilienceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutionCoordinatorTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final BackendResilienceProperties resilienceProperties = new BackendResilienceProperties();
    private BackendResilienceRegistry registry;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parallelPlanOverlapsBackendCalls() {
        ExecutionCoordinator coordinator = coordinator(
            new FakeAdapter(Backend.VECTOR, 200L, "v1"),
            new FakeAdapter(Backend.GRAPH, 200L, "g1")
        );

        List<BackendResult> results = coordinator.execute(plan(ExecutionStrategy.PARALLEL, Backend.VECTOR, Backend.GRAPH));

        BackendResult vector = results.get(0);
        BackendResult graph = results.get(1);
        assertThat(vector.getBackend()).isEqualTo(Backend.VECTOR);
        assertThat(graph.getBackend()).isEqualTo(Backend.GRAPH);
        assertThat(vector.getStartedAtNanos()).isLessThan(graph.getFinishedAtNanos());
        assertThat(graph.getStartedAtNanos()).isLessThan(vector.getFinishedAtNanos());
    }

    @Test
    void sequentialPlanRunsOneBackendAtATime() {
        ExecutionCoordinator coordinator = coordinator(
            new FakeAdapter(Backend.VECTOR, 50L, "v1"),
            new FakeAdapter(Backend.GRAPH, 50L, "g1"),
            new FakeAdapter(Backend.METADATA, 50L, "m1")
        );

        List<BackendResult> results = coordinator.execute(
            plan(ExecutionStrategy.SEQUENTIAL, Backend.VECTOR, Backend.GRAPH, Backend.METADATA)
        );

        assertThat(results).extracting(BackendResult::getBackend)
            .containsExactly(Backend.VECTOR, Backend.GRAPH, Backend.METADATA);
        for (int i = 0; i + 1 < results.size(); i++) {
            assertThat(results.get(i).getFinishedAtNanos()).isLessThanOrEqualTo(results.get(i + 1).getStartedAtNanos());
        }
    }

    @Test
    void failingBackendDoesNotSinkThePass() {
        ExecutionCoordinator coordinator = coordinator(
            new FakeAdapter(Backend.VECTOR, 0L, "v1", "v2"),
            FakeAdapter.failing(Backend.GRAPH, new BackendUnavailableException("graph store unavailable: 503"))
        );

        List<BackendResult> results = coordinator.execute(plan(ExecutionStrategy.PARALLEL, Backend.VECTOR, Backend.GRAPH));

        assertThat(results.get(0).isError()).isFalse();
        assertThat(results.get(0).getItems()).hasSize(2);
        assertThat(results.get(1).isError()).isTrue();
        assertThat(results.get(1).getErrorMessage()).contains("503");
        assertThat(meterRegistry.counter("orchestrator.backend.calls", "backend", "graph", "outcome", "error").count())
            .isEqualTo(1.0);
        assertThat(meterRegistry.counter("orchestrator.backend.calls", "backend", "vector", "outcome", "success").count())
            .isEqualTo(1.0);
    }

    @Test
    void unexpectedExceptionBecomesErrorResult() {
        ExecutionCoordinator coordinator = coordinator(
            FakeAdapter.failing(Backend.VECTOR, new IllegalStateException("bad payload"))
        );

        List<BackendResult> results = coordinator.execute(plan(ExecutionStrategy.PARALLEL, Backend.VECTOR));

        assertThat(results.get(0).isError()).isTrue();
        assertThat(results.get(0).getErrorMessage()).contains("IllegalStateException").contains("bad payload");
    }

    @Test
    void slowBackendIsTaggedTimeoutAtDeadline() {
        ExecutionCoordinator coordinator = coordinator(
            new FakeAdapter(Backend.VECTOR, 0L, "v1"),
            new FakeAdapter(Backend.GRAPH, 2_000L, "g1")
        );

        long started = System.nanoTime();
        List<BackendResult> results = coordinator.execute(
            plan(ExecutionStrategy.PARALLEL, Backend.VECTOR, Backend.GRAPH),
            Deadline.afterMs(150)
        );
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertThat(results.get(0).isError()).isFalse();
        assertThat(results.get(1).isTimedOut()).isTrue();
        assertThat(elapsedMs).isLessThan(1_500L);
    }

    @Test
    void expiredDeadlineSkipsRemainingSequentialBackends() throws Exception {
        ExecutionCoordinator coordinator = coordinator(
            new FakeAdapter(Backend.VECTOR, 0L, "v1"),
            new FakeAdapter(Backend.GRAPH, 0L, "g1")
        );
        Deadline deadline = Deadline.afterMs(1);
        Thread.sleep(5L);

        List<BackendResult> results = coordinator.execute(
            plan(ExecutionStrategy.SEQUENTIAL, Backend.VECTOR, Backend.GRAPH),
            deadline
        );

        assertThat(results).allSatisfy(result -> assertThat(result.isTimedOut()).isTrue());
    }

    @Test
    void openCircuitSkipsBackend() {
        resilienceProperties.setGraphFailureThreshold(1);
        FakeAdapter graph = new FakeAdapter(Backend.GRAPH, 0L, "g1");
        ExecutionCoordinator coordinator = coordinator(new FakeAdapter(Backend.VECTOR, 0L, "v1"), graph);
        registry.breakerFor(Backend.GRAPH).recordFailure();

        List<BackendResult> results = coordinator.execute(plan(ExecutionStrategy.PARALLEL, Backend.VECTOR, Backend.GRAPH));

        assertThat(results.get(1).isSkipped()).isTrue();
        assertThat(results.get(1).getErrorMessage()).isEqualTo(ExecutionCoordinator.CIRCUIT_OPEN);
        assertThat(graph.calls).isZero();
    }

    @Test
    void missingAdapterIsSkipped() {
        ExecutionCoordinator coordinator = coordinator(new FakeAdapter(Backend.VECTOR, 0L, "v1"));

        List<BackendResult> results = coordinator.execute(plan(ExecutionStrategy.PARALLEL, Backend.VECTOR, Backend.METADATA));

        assertThat(results.get(1).isSkipped()).isTrue();
        assertThat(results.get(1).getErrorMessage()).isEqualTo(ExecutionCoordinator.NO_ADAPTER);
    }

    private ExecutionCoordinator coordinator(BackendAdapter... adapters) {
        registry = new BackendResilienceRegistry(resilienceProperties);
        return new ExecutionCoordinator(List.of(adapters), executor, registry, meterRegistry);
    }

    private static ExecutionPlan plan(ExecutionStrategy strategy, Backend... backends) {
        return new ExecutionPlan(Intent.COMPREHENSIVE, List.of(backends), strategy, 10, 10, "trauma", QueryParams.empty());
    }

    static final class FakeAdapter implements BackendAdapter {
        private final Backend backend;
        private final long sleepMs;
        private final List<String> ids;
        private final RuntimeException failure;
        private volatile int calls;

        FakeAdapter(Backend backend, long sleepMs, String... ids) {
            this(backend, sleepMs, List.of(ids), null);
        }

        private FakeAdapter(Backend backend, long sleepMs, List<String> ids, RuntimeException failure) {
            this.backend = backend;
            this.sleepMs = sleepMs;
            this.ids = ids;
            this.failure = failure;
        }

        static FakeAdapter failing(Backend backend, RuntimeException failure) {
            return new FakeAdapter(backend, 0L, List.of(), failure);
        }

        @Override
        public Backend backend() {
            return backend;
        }

        @Override
        public List<Item> retrieve(BackendCall call) {
            calls++;
            if (sleepMs > 0) {
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return List.of();
                }
            }
            if (failure != null) {
                throw failure;
            }
            return ids.stream().map(id -> Item.of(id, "Title " + id)).toList();
        }
    }
}
