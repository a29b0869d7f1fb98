package com.psl.orchestrator.resilience;

import com.psl.orchestrator.plan.Backend;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class BackendResilienceRegistry {
    private final BackendResilienceProperties properties;
    private final Map<Backend, CircuitBreaker> breakers = new EnumMap<>(Backend.class);

    public BackendResilienceRegistry(BackendResilienceProperties properties) {
        this.properties = properties;
        breakers.put(Backend.VECTOR, new CircuitBreaker(
            Backend.VECTOR.wireName(), properties.getVectorFailureThreshold(), properties.getVectorOpenMs()));
        breakers.put(Backend.GRAPH, new CircuitBreaker(
            Backend.GRAPH.wireName(), properties.getGraphFailureThreshold(), properties.getGraphOpenMs()));
        breakers.put(Backend.METADATA, new CircuitBreaker(
            Backend.METADATA.wireName(), properties.getMetadataFailureThreshold(), properties.getMetadataOpenMs()));
    }

    public CircuitBreaker breakerFor(Backend backend) {
        return breakers.get(backend);
    }

    public boolean allowRequest(Backend backend) {
        return !properties.isEnabled() || breakerFor(backend).allowRequest();
    }

    public BackendResilienceProperties getProperties() {
        return properties;
    }
}
