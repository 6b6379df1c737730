package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Symbol;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;

import static com.codegraph.core.service.store.GraphFixtures.REPO;
import static com.codegraph.core.service.store.GraphFixtures.calls;
import static com.codegraph.core.service.store.GraphFixtures.function;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the store contract against a real Neo4j server. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestMethodOrder(MethodOrderer.DisplayName.class)
class Neo4jGraphStoreTest {

    @Container
    static Neo4jContainer<?> neo4jContainer = new Neo4jContainer<>("neo4j:5.15.0")
            .withoutAuthentication();

    private static Driver driver;
    private static Neo4jGraphStore store;

    private final Symbol main = function("main", "app.py", 1);
    private final Symbol helper = function("helper", "app.py", 10, "x");
    private final Symbol validate = function("validate", "app.py", 20, "data");

    @BeforeAll
    static void connect() {
        driver = GraphDatabase.driver(neo4jContainer.getBoltUrl(), AuthTokens.none());
        store = new Neo4jGraphStore(driver, "", new ObjectMapper(), 100, 10);
        store.connect();
    }

    @AfterAll
    static void close() {
        if (driver != null) {
            driver.close();
        }
    }

    @BeforeEach
    void clean() {
        store.deleteRepository(REPO);
    }

    @Test
    @DisplayName("Operations fail before connect")
    void rejectsOperationsBeforeConnect() {
        var disconnected = new Neo4jGraphStore(driver, "", new ObjectMapper(), 100, 10);

        assertThatThrownBy(() -> disconnected.countSymbols(REPO))
                .isInstanceOf(GraphStoreNotConnectedException.class);
    }

    @Test
    @DisplayName("Repeated upserts keep one node and one relationship")
    void upsertsAreIdempotent() {
        store.connect();
        for (int i = 0; i < 2; i++) {
            store.upsertSymbol(main);
            store.upsertSymbol(helper);
            store.upsertEdge(calls(main, helper, 2));
        }

        assertThat(store.countSymbols(REPO)).isEqualTo(2);
        assertThat(store.countEdges(REPO)).isEqualTo(1);
        assertThat(store.callGraph(REPO)).isEqualTo(Map.of("main", List.of("helper")));
    }

    @Test
    @DisplayName("Symbols read back with their attributes")
    void symbolRoundTrip() {
        Symbol documented = helper.toBuilder().docstring("Helps.").signature("helper(x)").build();
        store.upsertSymbol(documented);

        Symbol loaded = store.getSymbol(documented.id()).orElseThrow();

        assertThat(loaded.name()).isEqualTo("helper");
        assertThat(loaded.docstring()).isEqualTo("Helps.");
        assertThat(loaded.span()).isEqualTo(documented.span());
        assertThat(loaded.parameterNames()).containsExactly("x");
    }

    @Test
    @DisplayName("Analytical queries match the graph shape")
    void analyticalQueries() {
        store.importBulk(new GraphImportData(REPO,
                List.of(main, helper, validate),
                List.of(calls(main, helper, 2), calls(helper, validate, 11), calls(validate, helper, 21))));

        assertThat(store.orphanSymbols(REPO)).extracting(Symbol::name).containsExactly("main");
        assertThat(store.endpointsWithoutValidation(REPO)).extracting(Symbol::name).containsExactly("validate");
        assertThat(store.cycles(REPO)).contains(List.of("helper", "validate", "helper"));
    }

    @Test
    @DisplayName("Delete removes the repository")
    void deleteRepository() {
        store.importBulk(new GraphImportData(REPO, List.of(main, helper), List.of(calls(main, helper, 2))));

        assertThat(store.deleteRepository(REPO)).isEqualTo(2);
        assertThat(store.countSymbols(REPO)).isZero();
        assertThat(store.countEdges(REPO)).isZero();
        assertThat(store.export(REPO).nodes()).isEmpty();
    }
}
