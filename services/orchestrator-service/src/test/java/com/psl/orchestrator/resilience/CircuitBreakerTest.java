package com.psl.orchestrator.resilience;

import static org.assertj.core.api.Assertions.assertThat;

import com.psl.orchestrator.plan.Backend;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    @Test
    void opensAfterThresholdAndClosesAfterDuration() {
        AtomicLong now = new AtomicLong(1_000L);
        CircuitBreaker breaker = new CircuitBreaker("graph", 3, 500L, now::get);

        assertThat(breaker.recordFailure()).isFalse();
        assertThat(breaker.recordFailure()).isFalse();
        assertThat(breaker.recordFailure()).isTrue();
        assertThat(breaker.isOpen()).isTrue();

        now.addAndGet(499L);
        assertThat(breaker.allowRequest()).isFalse();
        now.addAndGet(1L);
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    void successResetsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("vector", 2, 1_000L, () -> 0L);

        breaker.recordFailure();
        breaker.recordSuccess();

        assertThat(breaker.recordFailure()).isFalse();
        assertThat(breaker.allowRequest()).isTrue();
    }

    @Test
    void registryBypassesBreakersWhenDisabled() {
        BackendResilienceProperties properties = new BackendResilienceProperties();
        properties.setGraphFailureThreshold(1);
        BackendResilienceRegistry registry = new BackendResilienceRegistry(properties);

        registry.breakerFor(Backend.GRAPH).recordFailure();
        assertThat(registry.allowRequest(Backend.GRAPH)).isFalse();

        properties.setEnabled(false);
        assertThat(registry.allowRequest(Backend.GRAPH)).isTrue();
    }
}
