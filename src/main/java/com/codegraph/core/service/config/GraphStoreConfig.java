package com.codegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the graph store.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "codegraph.store")
public class GraphStoreConfig {

    /**
     * Storage backend.
     */
    private Backend backend = Backend.NEO4J;

    /**
     * Maximum number of cycles returned by a cycle query.
     */
    private int cycleLimit = 100;

    /**
     * Maximum relationship count of a reported cycle.
     */
    private int cycleMaxDepth = 10;

    /**
     * Neo4j connection settings, used when the backend is {@code neo4j}.
     */
    private Neo4jSettings neo4j = new Neo4jSettings();

    public enum Backend {
        NEO4J,
        MEMORY
    }

    @Getter
    @Setter
    public static class Neo4jSettings {

        /**
         * Bolt URI of the Neo4j server.
         */
        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";

        /**
         * Database name; blank selects the server default.
         */
        private String database = "";

        /**
         * Maximum number of pooled connections.
         */
        private int maxConnectionPoolSize = 50;

        /**
         * Connection acquisition timeout in milliseconds.
         */
        private long connectionTimeoutMs = 5000;
    }
}
