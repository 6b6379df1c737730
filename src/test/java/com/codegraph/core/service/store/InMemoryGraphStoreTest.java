package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static com.codegraph.core.service.store.GraphFixtures.REPO;
import static com.codegraph.core.service.store.GraphFixtures.calls;
import static com.codegraph.core.service.store.GraphFixtures.edge;
import static com.codegraph.core.service.store.GraphFixtures.function;
import static com.codegraph.core.service.store.GraphFixtures.symbol;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(100, 10);
        store.connect();
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("Operations before connect fail with GRAPH_STORE_NOT_CONNECTED")
    void rejectsOperationsBeforeConnect() {
        var disconnected = new InMemoryGraphStore(100, 10);

        assertThat(disconnected.isConnected()).isFalse();
        assertThatThrownBy(() -> disconnected.upsertSymbol(function("a", "a.py", 1)))
                .isInstanceOf(GraphStoreNotConnectedException.class)
                .extracting("errorCode")
                .isEqualTo(GraphStoreNotConnectedException.NOT_CONNECTED);
        assertThatThrownBy(() -> disconnected.callGraph(REPO))
                .isInstanceOf(GraphStoreNotConnectedException.class);
    }

    @Test
    void connectIsIdempotent() {
        store.connect();

        assertThat(store.isConnected()).isTrue();
        assertThat(store.getBackendName()).isEqualTo("memory");
    }

    // ==================== Writes ====================

    @Nested
    @DisplayName("Upserts")
    class Upserts {

        @Test
        @DisplayName("Writing the same symbol twice leaves one symbol")
        void symbolUpsertIsIdempotent() {
            Symbol foo = function("foo", "a.py", 1);

            store.upsertSymbol(foo);
            store.upsertSymbol(foo);

            assertThat(store.countSymbols(REPO)).isEqualTo(1);
        }

        @Test
        @DisplayName("A second write with the same id overwrites attributes")
        void symbolUpsertOverwritesAttributes() {
            Symbol foo = function("foo", "a.py", 1);
            store.upsertSymbol(foo);

            store.upsertSymbol(foo.toBuilder().docstring("Updated.").build());

            assertThat(store.getSymbol(foo.id()))
                    .get()
                    .extracting(Symbol::docstring)
                    .isEqualTo("Updated.");
            assertThat(store.countSymbols(REPO)).isEqualTo(1);
        }

        @Test
        @DisplayName("Repeated edge upserts keep one edge and one relationship")
        void edgeUpsertIsIdempotent() {
            Symbol a = function("a", "a.py", 1);
            Symbol b = function("b", "a.py", 5);
            store.upsertSymbol(a);
            store.upsertSymbol(b);

            Edge call = calls(a, b, 2);
            store.upsertEdge(call);
            store.upsertEdge(call);

            assertThat(store.countEdges(REPO)).isEqualTo(1);
            assertThat(store.callGraph(REPO)).isEqualTo(Map.of("a", List.of("b")));
        }

        @Test
        @DisplayName("Unresolved edges are stored without a relationship")
        void unresolvedEdgeHasNoRelationship() {
            Symbol a = function("a", "a.py", 1);
            store.upsertSymbol(a);

            Edge unresolved = Edge.builder()
                    .id("calls:a->?")
                    .repoId(REPO)
                    .sourceId(a.id())
                    .kind(EdgeKind.CALLS)
                    .attributes(Map.of(Edge.ATTR_CALLEE, "elsewhere"))
                    .build();
            store.upsertEdge(unresolved);

            assertThat(store.getEdge(unresolved.id())).isPresent();
            assertThat(store.callGraph(REPO)).isEmpty();
            assertThat(store.export(REPO).links()).isEmpty();
        }

        @Test
        @DisplayName("Edges written before their target symbol get no relationship")
        void edgeBeforeTargetHasNoRelationship() {
            Symbol a = function("a", "a.py", 1);
            Symbol b = function("b", "a.py", 5);
            store.upsertSymbol(a);

            store.upsertEdge(calls(a, b, 2));
            store.upsertSymbol(b);

            assertThat(store.countEdges(REPO)).isEqualTo(1);
            assertThat(store.callGraph(REPO)).isEmpty();
        }
    }

    @Test
    @DisplayName("Concurrent upserts from several writers leave one copy of each symbol and edge")
    void concurrentUpsertsAreIdempotent() throws Exception {
        List<Symbol> chain = IntStream.range(0, 50)
                .mapToObj(i -> function("f" + i, "chain.py", i * 3 + 1))
                .toList();
        List<Edge> links = IntStream.range(1, chain.size())
                .mapToObj(i -> calls(chain.get(i - 1), chain.get(i), i * 3))
                .toList();
        ExecutorService writers = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Void>> symbolWrites = new ArrayList<>();
            List<Callable<Void>> edgeWrites = new ArrayList<>();
            for (int writer = 0; writer < 8; writer++) {
                symbolWrites.add(() -> {
                    chain.forEach(store::upsertSymbol);
                    return null;
                });
                edgeWrites.add(() -> {
                    links.forEach(store::upsertEdge);
                    return null;
                });
            }
            for (Future<Void> write : writers.invokeAll(symbolWrites)) {
                write.get();
            }
            for (Future<Void> write : writers.invokeAll(edgeWrites)) {
                write.get();
            }
        } finally {
            writers.shutdown();
        }

        assertThat(store.countSymbols(REPO)).isEqualTo(50);
        assertThat(store.countEdges(REPO)).isEqualTo(49);
        assertThat(store.export(REPO).links()).hasSize(49);
        assertThat(store.callGraph(REPO)).hasSize(49)
                .containsEntry("f0", List.of("f1"));
        assertThat(store.orphanSymbols(REPO)).extracting(Symbol::name).containsExactly("f0");
    }

    @Test
    @DisplayName("Bulk import loads symbols before edges")
    void bulkImportLoadsSymbolsFirst() {
        Symbol a = function("a", "a.py", 1);
        Symbol b = function("b", "a.py", 5);

        ImportSummary summary = store.importBulk(new GraphImportData(REPO, List.of(a, b), List.of(calls(a, b, 2))));

        assertThat(summary).isEqualTo(new ImportSummary(REPO, 2, 1));
        assertThat(store.callGraph(REPO)).containsEntry("a", List.of("b"));
    }

    @Test
    @DisplayName("Deleting a repository removes only its symbols and edges")
    void deleteRepositoryIsScoped() {
        Symbol a = function("a", "a.py", 1);
        Symbol b = function("b", "a.py", 5);
        Symbol other = a.toBuilder().id("other:a").repoId("other").build();
        store.importBulk(new GraphImportData(REPO, List.of(a, b), List.of(calls(a, b, 2))));
        store.upsertSymbol(other);

        long deleted = store.deleteRepository(REPO);

        assertThat(deleted).isEqualTo(2);
        assertThat(store.countSymbols(REPO)).isZero();
        assertThat(store.countEdges(REPO)).isZero();
        assertThat(store.countSymbols("other")).isEqualTo(1);
        assertThat(store.deleteRepository(REPO)).isZero();
    }

    // ==================== Lookups ====================

    @Test
    @DisplayName("Symbols are ordered by file then start line")
    void symbolsOrderedByFileAndLine() {
        store.upsertSymbol(function("late", "b.py", 1));
        store.upsertSymbol(function("second", "a.py", 10));
        store.upsertSymbol(function("first", "a.py", 2));

        assertThat(store.getSymbolsByRepo(REPO))
                .extracting(Symbol::name)
                .containsExactly("first", "second", "late");
        assertThat(store.getSymbolsByFile(REPO, "a.py"))
                .extracting(Symbol::name)
                .containsExactly("first", "second");
        assertThat(store.getSymbol("missing")).isEmpty();
    }

    // ==================== Analytical Queries ====================

    @Nested
    @DisplayName("Analytical queries")
    class Queries {

        private Symbol main;
        private Symbol helper;
        private Symbol validateInput;
        private Symbol handler;

        @BeforeEach
        void seed() {
            main = function("main", "app.py", 1);
            helper = function("helper", "app.py", 10, "x");
            validateInput = function("validate_input", "app.py", 20, "data");
            handler = function("handler", "app.py", 30, "request");
            store.importBulk(new GraphImportData(REPO,
                    List.of(main, helper, validateInput, handler),
                    List.of(
                            calls(main, helper, 3),
                            calls(main, handler, 2),
                            calls(helper, validateInput, 12))));
        }

        @Test
        @DisplayName("Call graph lists callees in call-site order")
        void callGraphOrderedByCallSite() {
            Map<String, List<String>> graph = store.callGraph(REPO);

            assertThat(graph.keySet()).containsExactly("main", "helper");
            assertThat(graph.get("main")).containsExactly("handler", "helper");
            assertThat(graph.get("helper")).containsExactly("validate_input");
        }

        @Test
        @DisplayName("Orphans have no incoming relationship and skip modules")
        void orphansExcludeModules() {
            store.upsertSymbol(symbol("app", SymbolKind.MODULE, "app.py", 1, List.of()));

            assertThat(store.orphanSymbols(REPO))
                    .extracting(Symbol::name)
                    .containsExactly("main");
        }

        @Test
        @DisplayName("A method contained by its class is not an orphan")
        void containedMethodIsNotOrphan() {
            Symbol box = symbol("Box", SymbolKind.CLASS, "app.py", 60, List.of());
            Symbol open = symbol("open", SymbolKind.METHOD, "app.py", 61, List.of("self"));
            store.upsertSymbol(box);
            store.upsertSymbol(open);
            store.upsertEdge(edge(EdgeKind.CONTAINS, box, open, 61));

            assertThat(store.orphanSymbols(REPO))
                    .extracting(Symbol::name)
                    .containsExactly("main", "Box");
        }

        @Test
        @DisplayName("Functions with parameters and no validation call are reported")
        void endpointsWithoutValidation() {
            Symbol checkAuth = function("CheckAuth", "app.py", 40);
            store.upsertSymbol(checkAuth);
            store.upsertEdge(calls(handler, checkAuth, 31));
            Symbol unguarded = function("unguarded", "app.py", 50, "payload");
            store.upsertSymbol(unguarded);

            assertThat(store.endpointsWithoutValidation(REPO))
                    .extracting(Symbol::name)
                    .containsExactly("validate_input", "unguarded");
        }

        @Test
        @DisplayName("An acyclic graph has no cycles")
        void noCycles() {
            assertThat(store.cycles(REPO)).isEmpty();
        }

        @Test
        @DisplayName("Cycles are reported as closed name paths")
        void reportsCycles() {
            store.upsertEdge(calls(validateInput, main, 21));

            assertThat(store.cycles(REPO)).contains(List.of("main", "helper", "validate_input", "main"));
        }

        @Test
        @DisplayName("A self-call is a cycle of length one")
        void reportsSelfLoop() {
            store.upsertEdge(calls(handler, handler, 31));

            assertThat(store.cycles(REPO)).containsExactly(List.of("handler", "handler"));
        }

        @Test
        @DisplayName("Cycles through other relationship kinds are reported")
        void cyclesAcrossKinds() {
            store.upsertEdge(edge(EdgeKind.IMPORTS, validateInput, helper, 20));

            assertThat(store.cycles(REPO)).isNotEmpty()
                    .allSatisfy(cycle -> assertThat(cycle.get(0)).isEqualTo(cycle.get(cycle.size() - 1)));
        }
    }

    @Test
    @DisplayName("Export then import into a fresh store yields the same graph")
    void exportImportRoundTrip() {
        Symbol a = function("a", "a.py", 1);
        Symbol b = function("b", "a.py", 5);
        store.importBulk(new GraphImportData(REPO, List.of(a, b), List.of(calls(a, b, 2))));

        GraphDocument document = store.export(REPO);
        var fresh = new InMemoryGraphStore(100, 10);
        fresh.connect();
        fresh.importBulk(GraphImportData.fromDocument(document));

        assertThat(document.directed()).isTrue();
        assertThat(fresh.countSymbols(REPO)).isEqualTo(2);
        assertThat(fresh.callGraph(REPO)).isEqualTo(store.callGraph(REPO));
        assertThat(fresh.export(REPO).links()).isEqualTo(document.links());
    }
}
