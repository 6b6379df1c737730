package com.codegraph.core.service.config;

import com.codegraph.core.service.store.GraphStore;
import com.codegraph.core.service.store.GraphStoreException;
import com.codegraph.core.service.store.InMemoryGraphStore;
import com.codegraph.core.service.store.Neo4jGraphStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Graph store wiring.
 *
 * The Neo4j driver exists only for the {@code neo4j} backend and is closed by the container.
 */
@Slf4j
@Configuration
public class GraphStoreConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "codegraph.store", name = "backend", havingValue = "neo4j", matchIfMissing = true)
    public Driver graphDriver(GraphStoreConfig storeConfig) {
        var neo4j = storeConfig.getNeo4j();
        Config driverConfig = Config.builder()
                .withMaxConnectionPoolSize(neo4j.getMaxConnectionPoolSize())
                .withConnectionAcquisitionTimeout(neo4j.getConnectionTimeoutMs(), TimeUnit.MILLISECONDS)
                .withConnectionTimeout(neo4j.getConnectionTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        log.info("Creating Neo4j driver (uri={}, database={})", neo4j.getUri(), neo4j.getDatabase());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()),
                driverConfig);
    }

    @Bean
    public GraphStore graphStore(GraphStoreConfig storeConfig,
                                 ObjectProvider<Driver> driver,
                                 ObjectMapper objectMapper) {
        return switch (storeConfig.getBackend()) {
            case NEO4J -> new Neo4jGraphStore(driver.getObject(), storeConfig.getNeo4j().getDatabase(),
                    objectMapper, storeConfig.getCycleLimit(), storeConfig.getCycleMaxDepth());
            case MEMORY -> new InMemoryGraphStore(storeConfig.getCycleLimit(), storeConfig.getCycleMaxDepth());
        };
    }

    /**
     * Connects the store once the context is up. A failed connection leaves the store
     * disconnected; store operations then fail with GRAPH_STORE_NOT_CONNECTED.
     */
    @Bean
    public ApplicationRunner graphStoreInitializer(GraphStore graphStore, CodeGraphConfig codeGraphConfig) {
        return args -> {
            if (!codeGraphConfig.getFeatures().isConnectOnStartup()) {
                log.info("Graph store connection on startup is disabled");
                return;
            }
            try {
                graphStore.connect();
            } catch (GraphStoreException e) {
                log.warn("Graph store '{}' is not available at startup: {}",
                        graphStore.getBackendName(), e.getMessage());
            }
        };
    }
}
