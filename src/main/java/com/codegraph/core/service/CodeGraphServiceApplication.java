package com.codegraph.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CodeGraph Core Service - Entry point for the Spring Boot application.
 *
 * This application builds and serves code knowledge graphs:
 * - Clones a repository and extracts symbols and relationships per source file
 * - Stores them idempotently in Neo4j (or in memory)
 * - Runs graph analyses and turns findings into change proposals
 *
 * The Neo4j driver is created by {@code GraphStoreConfiguration}, so Boot's own Neo4j
 * auto-configuration is excluded.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.codegraph.core.service.config")
public class CodeGraphServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeGraphServiceApplication.class, args);
    }
}
