package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of GraphStore.
 * Thread-safe storage backed by concurrent maps; used for tests and single-node deployments.
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private static final String BACKEND = "memory";
    private static final List<String> VALIDATION_MARKERS = List.of("validate", "check");

    static final Comparator<Symbol> BY_POSITION = Comparator
            .comparing(Symbol::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(symbol -> symbol.span().startLine())
            .thenComparingInt(symbol -> symbol.span().startColumn());

    private final int cycleLimit;
    private final int cycleMaxDepth;

    private final Map<String, Symbol> symbols = new ConcurrentHashMap<>();
    private final Map<String, Edge> edges = new ConcurrentHashMap<>();
    // edge id -> edge, only for edges whose endpoints were both stored at upsert time
    private final Map<String, Edge> relationships = new ConcurrentHashMap<>();

    private volatile boolean connected;

    public InMemoryGraphStore(int cycleLimit, int cycleMaxDepth) {
        this.cycleLimit = cycleLimit;
        this.cycleMaxDepth = cycleMaxDepth;
    }

    // ==================== Lifecycle ====================

    @Override
    public void connect() {
        if (!connected) {
            connected = true;
            log.info("In-memory graph store connected");
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }

    // ==================== Writes ====================

    @Override
    public void upsertSymbol(Symbol symbol) {
        ensureConnected();
        symbols.put(symbol.id(), symbol);
    }

    @Override
    public void upsertEdge(Edge edge) {
        ensureConnected();
        edges.put(edge.id(), edge);
        if (edge.isResolved() && symbols.containsKey(edge.sourceId()) && symbols.containsKey(edge.targetId())) {
            relationships.put(edge.id(), edge);
        } else {
            log.debug("Edge {} stored without relationship", edge.id());
        }
    }

    @Override
    public ImportSummary importBulk(GraphImportData data) {
        ensureConnected();
        data.symbols().forEach(this::upsertSymbol);
        data.edges().forEach(this::upsertEdge);
        log.info("Imported {} symbols and {} edges into repository {}",
                data.symbols().size(), data.edges().size(), data.repoId());
        return new ImportSummary(data.repoId(), data.symbols().size(), data.edges().size());
    }

    @Override
    public long deleteRepository(String repoId) {
        ensureConnected();
        Set<String> removed = new HashSet<>();
        symbols.values().removeIf(symbol -> {
            if (Objects.equals(symbol.repoId(), repoId)) {
                removed.add(symbol.id());
                return true;
            }
            return false;
        });
        edges.values().removeIf(edge -> Objects.equals(edge.repoId(), repoId));
        relationships.values().removeIf(edge -> Objects.equals(edge.repoId(), repoId)
                || removed.contains(edge.sourceId())
                || removed.contains(edge.targetId()));
        log.info("Repository {} deleted from in-memory store ({} symbols)", repoId, removed.size());
        return removed.size();
    }

    // ==================== Lookups ====================

    @Override
    public Optional<Symbol> getSymbol(String symbolId) {
        ensureConnected();
        return Optional.ofNullable(symbols.get(symbolId));
    }

    @Override
    public Optional<Edge> getEdge(String edgeId) {
        ensureConnected();
        return Optional.ofNullable(edges.get(edgeId));
    }

    @Override
    public List<Symbol> getSymbolsByRepo(String repoId) {
        ensureConnected();
        return repoSymbols(repoId);
    }

    @Override
    public List<Edge> getEdgesByRepo(String repoId) {
        ensureConnected();
        return edges.values().stream()
                .filter(edge -> Objects.equals(edge.repoId(), repoId))
                .sorted(Comparator.comparing(Edge::id))
                .toList();
    }

    @Override
    public List<Symbol> getSymbolsByFile(String repoId, String filePath) {
        ensureConnected();
        return repoSymbols(repoId).stream()
                .filter(symbol -> Objects.equals(symbol.filePath(), filePath))
                .toList();
    }

    @Override
    public long countSymbols(String repoId) {
        ensureConnected();
        return symbols.values().stream().filter(symbol -> Objects.equals(symbol.repoId(), repoId)).count();
    }

    @Override
    public long countEdges(String repoId) {
        ensureConnected();
        return edges.values().stream().filter(edge -> Objects.equals(edge.repoId(), repoId)).count();
    }

    // ==================== Analytical Queries ====================

    @Override
    public Map<String, List<String>> callGraph(String repoId) {
        ensureConnected();
        Comparator<Edge> byCallSite = Comparator
                .comparing((Edge edge) -> symbols.get(edge.sourceId()), BY_POSITION)
                .thenComparing(Edge::siteLine, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(Edge::siteColumn, Comparator.nullsFirst(Comparator.naturalOrder()));

        Map<String, List<String>> graph = new LinkedHashMap<>();
        repoRelationships(repoId).stream()
                .filter(edge -> edge.kind() == EdgeKind.CALLS)
                .sorted(byCallSite)
                .forEach(edge -> graph
                        .computeIfAbsent(symbols.get(edge.sourceId()).name(), k -> new ArrayList<>())
                        .add(symbols.get(edge.targetId()).name()));
        return graph;
    }

    @Override
    public List<Symbol> orphanSymbols(String repoId) {
        ensureConnected();
        Set<String> targets = new HashSet<>();
        relationships.values().forEach(edge -> targets.add(edge.targetId()));
        return repoSymbols(repoId).stream()
                .filter(symbol -> symbol.kind() != SymbolKind.MODULE)
                .filter(symbol -> !targets.contains(symbol.id()))
                .toList();
    }

    @Override
    public List<List<String>> cycles(String repoId) {
        ensureConnected();
        Map<String, List<String>> adjacency = new HashMap<>();
        repoRelationships(repoId).stream()
                .sorted(Comparator.comparing(Edge::id))
                .forEach(edge -> adjacency.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.targetId()));

        List<List<String>> cycles = new ArrayList<>();
        for (Symbol start : repoSymbols(repoId)) {
            if (cycles.size() >= cycleLimit) {
                break;
            }
            List<String> path = new ArrayList<>();
            path.add(start.id());
            walkCycles(start.id(), path, adjacency, cycles);
        }
        return cycles;
    }

    private void walkCycles(String startId, List<String> path, Map<String, List<String>> adjacency,
                            List<List<String>> cycles) {
        String current = path.get(path.size() - 1);
        for (String next : adjacency.getOrDefault(current, List.of())) {
            if (cycles.size() >= cycleLimit) {
                return;
            }
            if (next.equals(startId)) {
                List<String> names = new ArrayList<>();
                path.forEach(id -> names.add(symbols.get(id).name()));
                names.add(symbols.get(startId).name());
                cycles.add(names);
            } else if (path.size() < cycleMaxDepth && !path.contains(next)) {
                path.add(next);
                walkCycles(startId, path, adjacency, cycles);
                path.remove(path.size() - 1);
            }
        }
    }

    @Override
    public List<Symbol> endpointsWithoutValidation(String repoId) {
        ensureConnected();
        Map<String, List<Edge>> outgoing = new HashMap<>();
        relationships.values().forEach(edge -> outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge));

        return repoSymbols(repoId).stream()
                .filter(symbol -> symbol.kind() == SymbolKind.FUNCTION)
                .filter(symbol -> !symbol.parameterNames().isEmpty())
                .filter(symbol -> outgoing.getOrDefault(symbol.id(), List.of()).stream()
                        .map(edge -> symbols.get(edge.targetId()))
                        .filter(Objects::nonNull)
                        .noneMatch(target -> isValidationName(target.name())))
                .toList();
    }

    @Override
    public GraphDocument export(String repoId) {
        ensureConnected();
        List<GraphDocument.Node> nodes = repoSymbols(repoId).stream()
                .map(GraphDocument.Node::of)
                .toList();
        List<GraphDocument.Link> links = repoRelationships(repoId).stream()
                .map(GraphDocument.Link::of)
                .toList();
        return GraphDocument.of(repoId, nodes, links);
    }

    // ==================== Private Helpers ====================

    private void ensureConnected() {
        if (!connected) {
            throw new GraphStoreNotConnectedException(BACKEND);
        }
    }

    private List<Symbol> repoSymbols(String repoId) {
        return symbols.values().stream()
                .filter(symbol -> Objects.equals(symbol.repoId(), repoId))
                .sorted(BY_POSITION)
                .toList();
    }

    /**
     * Relationships whose endpoints are both still stored and belong to the repository.
     */
    private List<Edge> repoRelationships(String repoId) {
        return relationships.values().stream()
                .filter(edge -> isRepoSymbol(edge.sourceId(), repoId) && isRepoSymbol(edge.targetId(), repoId))
                .toList();
    }

    private boolean isRepoSymbol(String symbolId, String repoId) {
        Symbol symbol = symbols.get(symbolId);
        return symbol != null && Objects.equals(symbol.repoId(), repoId);
    }

    private static boolean isValidationName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return VALIDATION_MARKERS.stream().anyMatch(lower::contains);
    }
}
