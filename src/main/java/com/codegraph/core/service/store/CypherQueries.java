package com.codegraph.core.service.store;

import java.util.List;

/**
 * Cypher statements used by {@link Neo4jGraphStore}.
 *
 * Symbols are {@code :Symbol} nodes and edge records are {@code :Edge} nodes; resolved edges are
 * additionally materialised as {@code :RELATES} relationships keyed by {@code edge_id}, with the
 * edge kind in the {@code type} property.
 */
final class CypherQueries {

    static final String RELATIONSHIP = "RELATES";

    private CypherQueries() {
    }

    // ==================== Schema ====================

    static final List<String> SCHEMA = List.of(
            "CREATE CONSTRAINT symbol_id_unique IF NOT EXISTS FOR (s:Symbol) REQUIRE s.id IS UNIQUE",
            "CREATE CONSTRAINT edge_id_unique IF NOT EXISTS FOR (e:Edge) REQUIRE e.id IS UNIQUE",
            "CREATE INDEX symbol_name IF NOT EXISTS FOR (s:Symbol) ON (s.name)",
            "CREATE INDEX symbol_type IF NOT EXISTS FOR (s:Symbol) ON (s.type)",
            "CREATE INDEX symbol_file_path IF NOT EXISTS FOR (s:Symbol) ON (s.file_path)",
            "CREATE INDEX symbol_repo_id IF NOT EXISTS FOR (s:Symbol) ON (s.repo_id)",
            "CREATE INDEX edge_repo_id IF NOT EXISTS FOR (e:Edge) ON (e.repo_id)",
            "CREATE INDEX relates_type IF NOT EXISTS FOR ()-[r:RELATES]-() ON (r.type)"
    );

    // ==================== Writes ====================

    static final String UPSERT_SYMBOLS = """
            UNWIND $rows AS row
            MERGE (s:Symbol {id: row.id})
            SET s = row
            """;

    static final String UPSERT_EDGES = """
            UNWIND $rows AS row
            MERGE (e:Edge {id: row.id})
            SET e = row
            WITH row
            WHERE row.target_id IS NOT NULL
            MATCH (source:Symbol {id: row.source_id})
            MATCH (target:Symbol {id: row.target_id})
            MERGE (source)-[r:RELATES {edge_id: row.id}]->(target)
            SET r.type = row.type, r.repo_id = row.repo_id, r.line = row.line, r.column = row.column
            """;

    static final String DELETE_REPOSITORY_SYMBOLS = """
            MATCH (s:Symbol {repo_id: $repoId})
            DETACH DELETE s
            RETURN count(*) AS deleted
            """;

    static final String DELETE_REPOSITORY_EDGES = """
            MATCH (e:Edge {repo_id: $repoId})
            DELETE e
            """;

    // ==================== Lookups ====================

    static final String GET_SYMBOL = "MATCH (s:Symbol {id: $id}) RETURN s";

    static final String GET_EDGE = "MATCH (e:Edge {id: $id}) RETURN e";

    static final String SYMBOLS_BY_REPO = """
            MATCH (s:Symbol {repo_id: $repoId})
            RETURN s
            ORDER BY s.file_path, s.start_line, s.start_column
            """;

    static final String SYMBOLS_BY_FILE = """
            MATCH (s:Symbol {repo_id: $repoId, file_path: $filePath})
            RETURN s
            ORDER BY s.start_line, s.start_column
            """;

    static final String EDGES_BY_REPO = """
            MATCH (e:Edge {repo_id: $repoId})
            RETURN e
            ORDER BY e.id
            """;

    static final String COUNT_SYMBOLS = "MATCH (s:Symbol {repo_id: $repoId}) RETURN count(s) AS total";

    static final String COUNT_EDGES = "MATCH (e:Edge {repo_id: $repoId}) RETURN count(e) AS total";

    // ==================== Analytical Queries ====================

    static final String CALL_GRAPH = """
            MATCH (caller:Symbol {repo_id: $repoId})-[r:RELATES {type: 'calls'}]->(callee:Symbol)
            RETURN caller.name AS caller, callee.name AS callee
            ORDER BY caller.file_path, caller.start_line, caller.start_column, r.line, r.column
            """;

    static final String ORPHANS = """
            MATCH (s:Symbol {repo_id: $repoId})
            WHERE s.type <> 'module' AND NOT ()-[:RELATES]->(s)
            RETURN s
            ORDER BY s.file_path, s.start_line, s.start_column
            """;

    static final String ENDPOINTS_WITHOUT_VALIDATION = """
            MATCH (s:Symbol {repo_id: $repoId, type: 'function'})
            WHERE size(coalesce(s.parameters, [])) > 0
              AND NOT EXISTS {
                MATCH (s)-[:RELATES]->(t:Symbol)
                WHERE toLower(t.name) CONTAINS 'validate' OR toLower(t.name) CONTAINS 'check'
              }
            RETURN s
            ORDER BY s.file_path, s.start_line, s.start_column
            """;

    static final String EXPORT_LINKS = """
            MATCH (a:Symbol {repo_id: $repoId})-[r:RELATES]->(b:Symbol)
            OPTIONAL MATCH (e:Edge {id: r.edge_id})
            RETURN r.edge_id AS id, a.id AS source, b.id AS target, r.type AS type, e.attributes AS attributes
            """;

    /**
     * Variable-length bounds cannot be parameters, so the depth is rendered into the query.
     */
    static String cycles(int maxDepth) {
        return """
                MATCH p = (s:Symbol {repo_id: $repoId})-[:RELATES*1..%d]->(s)
                WHERE all(n IN nodes(p) WHERE n.repo_id = $repoId)
                RETURN [n IN nodes(p) | n.name] AS names
                LIMIT $limit
                """.formatted(Math.max(maxDepth, 1));
    }
}
