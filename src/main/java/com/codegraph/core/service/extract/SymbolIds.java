package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.SymbolKind;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Deterministic identities for symbols and edges.
 *
 * Re-extracting an unchanged file yields the same ids, so repeated ingestion converges
 * through upserts instead of accumulating duplicates.
 */
public final class SymbolIds {

    private SymbolIds() {
    }

    public static String symbolId(String repoId, String filePath, SymbolKind kind, String name, SourceSpan span) {
        return nameBased("symbol", repoId, filePath, kind.getValue(), name,
                String.valueOf(span.startLine()), String.valueOf(span.startColumn()));
    }

    /**
     * @param targetRef target symbol id, or a description of the external reference
     * @param line 1-based line of the syntax node that produced the edge
     * @param column 1-based column of the syntax node that produced the edge
     */
    public static String edgeId(String repoId, EdgeKind kind, String sourceId, String targetRef, int line, int column) {
        return nameBased("edge", repoId, kind.getValue(), sourceId, targetRef,
                String.valueOf(line), String.valueOf(column));
    }

    /**
     * Identity of the edge that replaces an unresolved edge once its target is known.
     */
    public static String resolvedEdgeId(String unresolvedEdgeId, String targetId) {
        return nameBased("resolved", unresolvedEdgeId, targetId);
    }

    private static String nameBased(String... parts) {
        var joined = new StringBuilder();
        for (String part : parts) {
            joined.append(Objects.toString(part, "")).append('\u0000');
        }
        return UUID.nameUUIDFromBytes(joined.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }
}
