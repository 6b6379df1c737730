package com.codegraph.core.service.api.health;

import com.codegraph.core.service.store.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the graph store backend is connected.
 */
@Component
@RequiredArgsConstructor
public class GraphStoreHealthIndicator implements HealthIndicator {

    private final GraphStore graphStore;

    @Override
    public Health health() {
        Health.Builder builder = graphStore.isConnected() ? Health.up() : Health.down();
        return builder
                .withDetail("backend", graphStore.getBackendName())
                .withDetail("connected", graphStore.isConnected())
                .build();
    }
}
