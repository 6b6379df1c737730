package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.neo4j.driver.types.MapAccessor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Neo4j-backed graph store.
 *
 * The driver is owned by the caller; this class never closes it. Writes rely on MERGE so
 * concurrent jobs can upsert the same identities safely.
 */
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final String BACKEND = "neo4j";
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {};

    private final Driver driver;
    private final String database;
    private final ObjectMapper objectMapper;
    private final int cycleLimit;
    private final int cycleMaxDepth;

    private final AtomicBoolean connected = new AtomicBoolean(false);

    public Neo4jGraphStore(Driver driver, String database, ObjectMapper objectMapper,
                           int cycleLimit, int cycleMaxDepth) {
        this.driver = driver;
        this.database = database;
        this.objectMapper = objectMapper;
        this.cycleLimit = cycleLimit;
        this.cycleMaxDepth = cycleMaxDepth;
    }

    // ==================== Lifecycle ====================

    @Override
    public void connect() {
        if (connected.get()) {
            return;
        }
        synchronized (connected) {
            if (connected.get()) {
                return;
            }
            try {
                driver.verifyConnectivity();
                createSchema();
            } catch (ServiceUnavailableException | SessionExpiredException e) {
                throw new GraphStoreUnavailableException("Neo4j is unreachable: " + e.getMessage(), e);
            } catch (Neo4jException e) {
                throw new GraphStoreException("Neo4j setup failed: " + e.getMessage(),
                        GraphStoreException.STORE_ERROR, e);
            }
            connected.set(true);
            log.info("Neo4j graph store connected (database: {})", databaseLabel());
        }
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }

    private void createSchema() {
        try (Session session = openSession()) {
            for (String statement : CypherQueries.SCHEMA) {
                session.run(statement).consume();
            }
        }
        log.debug("Neo4j constraints and indexes ensured");
    }

    // ==================== Writes ====================

    @Override
    public void upsertSymbol(Symbol symbol) {
        writeRows(CypherQueries.UPSERT_SYMBOLS, List.of(symbolRow(symbol)));
    }

    @Override
    public void upsertEdge(Edge edge) {
        writeRows(CypherQueries.UPSERT_EDGES, List.of(edgeRow(edge)));
    }

    @Override
    public ImportSummary importBulk(GraphImportData data) {
        List<Map<String, Object>> symbolRows = data.symbols().stream().map(this::symbolRow).toList();
        List<Map<String, Object>> edgeRows = data.edges().stream().map(this::edgeRow).toList();

        if (!symbolRows.isEmpty()) {
            writeRows(CypherQueries.UPSERT_SYMBOLS, symbolRows);
        }
        if (!edgeRows.isEmpty()) {
            writeRows(CypherQueries.UPSERT_EDGES, edgeRows);
        }
        log.info("Imported {} symbols and {} edges into repository {}",
                symbolRows.size(), edgeRows.size(), data.repoId());
        return new ImportSummary(data.repoId(), symbolRows.size(), edgeRows.size());
    }

    @Override
    public long deleteRepository(String repoId) {
        return execute(() -> {
            try (Session session = openSession()) {
                return session.executeWrite(tx -> {
                    long deleted = tx.run(CypherQueries.DELETE_REPOSITORY_SYMBOLS, Map.of("repoId", repoId))
                            .single().get("deleted").asLong();
                    tx.run(CypherQueries.DELETE_REPOSITORY_EDGES, Map.of("repoId", repoId)).consume();
                    return deleted;
                });
            }
        });
    }

    private void writeRows(String query, List<Map<String, Object>> rows) {
        execute(() -> {
            try (Session session = openSession()) {
                return session.executeWrite(tx -> tx.run(query, Map.of("rows", rows)).consume());
            }
        });
    }

    // ==================== Lookups ====================

    @Override
    public Optional<Symbol> getSymbol(String symbolId) {
        return read(CypherQueries.GET_SYMBOL, Map.of("id", symbolId), this::toSymbol).stream().findFirst();
    }

    @Override
    public Optional<Edge> getEdge(String edgeId) {
        return read(CypherQueries.GET_EDGE, Map.of("id", edgeId), this::toEdge).stream().findFirst();
    }

    @Override
    public List<Symbol> getSymbolsByRepo(String repoId) {
        return read(CypherQueries.SYMBOLS_BY_REPO, Map.of("repoId", repoId), this::toSymbol);
    }

    @Override
    public List<Edge> getEdgesByRepo(String repoId) {
        return read(CypherQueries.EDGES_BY_REPO, Map.of("repoId", repoId), this::toEdge);
    }

    @Override
    public List<Symbol> getSymbolsByFile(String repoId, String filePath) {
        return read(CypherQueries.SYMBOLS_BY_FILE, Map.of("repoId", repoId, "filePath", filePath), this::toSymbol);
    }

    @Override
    public long countSymbols(String repoId) {
        return read(CypherQueries.COUNT_SYMBOLS, Map.of("repoId", repoId), r -> r.get("total").asLong()).get(0);
    }

    @Override
    public long countEdges(String repoId) {
        return read(CypherQueries.COUNT_EDGES, Map.of("repoId", repoId), r -> r.get("total").asLong()).get(0);
    }

    // ==================== Analytical Queries ====================

    @Override
    public Map<String, List<String>> callGraph(String repoId) {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        read(CypherQueries.CALL_GRAPH, Map.of("repoId", repoId),
                r -> Map.entry(r.get("caller").asString(), r.get("callee").asString()))
                .forEach(call -> graph.computeIfAbsent(call.getKey(), k -> new ArrayList<>()).add(call.getValue()));
        return graph;
    }

    @Override
    public List<Symbol> orphanSymbols(String repoId) {
        return read(CypherQueries.ORPHANS, Map.of("repoId", repoId), this::toSymbol);
    }

    @Override
    public List<List<String>> cycles(String repoId) {
        return read(CypherQueries.cycles(cycleMaxDepth), Map.of("repoId", repoId, "limit", cycleLimit),
                r -> r.get("names").asList(Value::asString));
    }

    @Override
    public List<Symbol> endpointsWithoutValidation(String repoId) {
        return read(CypherQueries.ENDPOINTS_WITHOUT_VALIDATION, Map.of("repoId", repoId), this::toSymbol);
    }

    @Override
    public GraphDocument export(String repoId) {
        List<GraphDocument.Node> nodes = getSymbolsByRepo(repoId).stream()
                .map(GraphDocument.Node::of)
                .toList();
        List<GraphDocument.Link> links = read(CypherQueries.EXPORT_LINKS, Map.of("repoId", repoId), r ->
                new GraphDocument.Link(
                        r.get("id").asString(),
                        r.get("source").asString(),
                        r.get("target").asString(),
                        EdgeKind.fromValue(r.get("type").asString()),
                        readAttributes(nullableString(r, "attributes"))));
        return GraphDocument.of(repoId, nodes, links);
    }

    // ==================== Session Handling ====================

    private Session openSession() {
        if (database == null || database.isBlank()) {
            return driver.session();
        }
        return driver.session(SessionConfig.forDatabase(database));
    }

    private <T> List<T> read(String query, Map<String, Object> parameters, Function<Record, T> mapper) {
        return execute(() -> {
            try (Session session = openSession()) {
                return session.executeRead(tx -> tx.run(query, parameters).list(mapper));
            }
        });
    }

    private <T> T execute(Supplier<T> operation) {
        ensureConnected();
        try {
            return operation.get();
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            throw new GraphStoreUnavailableException("Neo4j is unreachable: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j operation failed: " + e.getMessage(),
                    GraphStoreException.STORE_ERROR, e);
        }
    }

    private void ensureConnected() {
        if (!connected.get()) {
            throw new GraphStoreNotConnectedException(BACKEND);
        }
    }

    private String databaseLabel() {
        return database == null || database.isBlank() ? "default" : database;
    }

    // ==================== Row Mapping ====================

    private Map<String, Object> symbolRow(Symbol symbol) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", symbol.id());
        row.put("repo_id", symbol.repoId());
        row.put("name", symbol.name());
        row.put("type", symbol.kind().getValue());
        row.put("file_path", symbol.filePath());
        row.put("language", symbol.language() != null ? symbol.language().getValue() : null);
        row.put("start_line", symbol.span().startLine());
        row.put("start_column", symbol.span().startColumn());
        row.put("end_line", symbol.span().endLine());
        row.put("end_column", symbol.span().endColumn());
        row.put("docstring", symbol.docstring());
        row.put("signature", symbol.signature());
        row.put("parent_id", symbol.parentId());
        row.put("parameters", symbol.parameterNames());
        row.put("attributes", writeAttributes(symbol.attributes()));
        return row;
    }

    private Map<String, Object> edgeRow(Edge edge) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", edge.id());
        row.put("repo_id", edge.repoId());
        row.put("source_id", edge.sourceId());
        row.put("target_id", edge.targetId());
        row.put("type", edge.kind().getValue());
        row.put("line", edge.siteLine());
        row.put("column", edge.siteColumn());
        row.put("attributes", writeAttributes(edge.attributes()));
        return row;
    }

    private Symbol toSymbol(Record record) {
        MapAccessor node = record.get(0).asNode();
        return Symbol.builder()
                .id(node.get("id").asString())
                .repoId(nullableString(node, "repo_id"))
                .name(node.get("name").asString())
                .kind(SymbolKind.fromValue(node.get("type").asString()))
                .filePath(nullableString(node, "file_path"))
                .language(Optional.ofNullable(nullableString(node, "language")).flatMap(Language::find).orElse(null))
                .span(new SourceSpan(
                        node.get("start_line").asInt(),
                        node.get("start_column").asInt(),
                        node.get("end_line").asInt(),
                        node.get("end_column").asInt()))
                .docstring(nullableString(node, "docstring"))
                .signature(nullableString(node, "signature"))
                .parentId(nullableString(node, "parent_id"))
                .attributes(readAttributes(nullableString(node, "attributes")))
                .build();
    }

    private Edge toEdge(Record record) {
        MapAccessor node = record.get(0).asNode();
        return Edge.builder()
                .id(node.get("id").asString())
                .repoId(nullableString(node, "repo_id"))
                .sourceId(node.get("source_id").asString())
                .targetId(nullableString(node, "target_id"))
                .kind(EdgeKind.fromValue(node.get("type").asString()))
                .attributes(readAttributes(nullableString(node, "attributes")))
                .build();
    }

    private static String nullableString(MapAccessor accessor, String key) {
        Value value = accessor.get(key);
        return value == null || value.isNull() ? null : value.asString();
    }

    private String writeAttributes(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Cannot serialise attributes: " + e.getMessage(),
                    GraphStoreException.STORE_ERROR, e);
        }
    }

    private Map<String, Object> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable attributes: {}", e.getMessage());
            return Map.of();
        }
    }
}
