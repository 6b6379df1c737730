package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.Symbol;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed, idempotent graph of symbols and edges, partitioned by repository.
 *
 * Every operation other than {@link #connect()}, {@link #isConnected()} and
 * {@link #getBackendName()} fails with {@link GraphStoreNotConnectedException} until the
 * store has been connected. Implementations are safe for concurrent use.
 */
public interface GraphStore {

    // ==================== Lifecycle ====================

    /**
     * Verifies connectivity and creates constraints and indexes. Idempotent.
     *
     * @throws GraphStoreUnavailableException if the backing service cannot be reached
     */
    void connect();

    boolean isConnected();

    /**
     * Short backend name, used in logs and health details.
     */
    String getBackendName();

    // ==================== Writes ====================

    /**
     * Creates the symbol if absent, otherwise overwrites its attributes.
     */
    void upsertSymbol(Symbol symbol);

    /**
     * Upserts the edge record and, when both endpoints are stored symbols, the directed
     * relationship between them. Relationships are keyed by edge id.
     */
    void upsertEdge(Edge edge);

    /**
     * Loads symbols first, then edges, with upsert semantics.
     */
    ImportSummary importBulk(GraphImportData data);

    /**
     * Removes every symbol, edge and relationship of the repository.
     *
     * @return number of symbols removed
     */
    long deleteRepository(String repoId);

    // ==================== Lookups ====================

    Optional<Symbol> getSymbol(String symbolId);

    Optional<Edge> getEdge(String edgeId);

    /**
     * Symbols ordered by file path, then start line.
     */
    List<Symbol> getSymbolsByRepo(String repoId);

    List<Edge> getEdgesByRepo(String repoId);

    /**
     * Symbols of one file ordered by start line.
     */
    List<Symbol> getSymbolsByFile(String repoId, String filePath);

    long countSymbols(String repoId);

    long countEdges(String repoId);

    // ==================== Analytical Queries ====================

    /**
     * Caller name to callee names over all {@code calls} relationships. One entry per
     * relationship, ordered by caller position then call-site position.
     */
    Map<String, List<String>> callGraph(String repoId);

    /**
     * Non-module symbols with no incoming relationship of any kind.
     */
    List<Symbol> orphanSymbols(String repoId);

    /**
     * Directed cycles as symbol-name paths that start and end at the same symbol.
     */
    List<List<String>> cycles(String repoId);

    /**
     * Functions with parameters and no outgoing relationship to a symbol whose name
     * contains "validate" or "check", ignoring case.
     */
    List<Symbol> endpointsWithoutValidation(String repoId);

    GraphDocument export(String repoId);
}
