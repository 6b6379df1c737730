package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialised intermediate form consumed by {@link GraphStore#importBulk(GraphImportData)}.
 */
public record GraphImportData(String repoId, List<Symbol> symbols, List<Edge> edges) {

    public GraphImportData {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Rebuilds import data from an exported document. Columns are not part of the export,
     * so spans start at column 1.
     *
     * @throws IllegalArgumentException if a node lacks its id, name or kind, or a link lacks its
     *                                  id, source or kind
     */
    public static GraphImportData fromDocument(GraphDocument document) {
        List<Symbol> symbols = new ArrayList<>(document.nodes().size());
        for (int i = 0; i < document.nodes().size(); i++) {
            GraphDocument.Node node = document.nodes().get(i);
            requireText(node.id(), "nodes", i, "id");
            requireText(node.name(), "nodes", i, "name");
            requirePresent(node.kind(), "nodes", i, "kind");
            symbols.add(toSymbol(document.repoId(), node));
        }
        List<Edge> edges = new ArrayList<>(document.links().size());
        for (int i = 0; i < document.links().size(); i++) {
            GraphDocument.Link link = document.links().get(i);
            requireText(link.id(), "links", i, "id");
            requireText(link.source(), "links", i, "source");
            requirePresent(link.kind(), "links", i, "kind");
            edges.add(toEdge(document.repoId(), link));
        }
        return new GraphImportData(document.repoId(), symbols, edges);
    }

    private static void requireText(String value, String list, int index, String field) {
        if (value == null || value.isBlank()) {
            throw missing(list, index, field);
        }
    }

    private static void requirePresent(Object value, String list, int index, String field) {
        if (value == null) {
            throw missing(list, index, field);
        }
    }

    private static IllegalArgumentException missing(String list, int index, String field) {
        return new IllegalArgumentException("Invalid graph document: " + list + "[" + index + "] has no " + field);
    }

    private static Symbol toSymbol(String repoId, GraphDocument.Node node) {
        int startLine = node.startLine() != null ? Math.max(node.startLine(), 1) : 1;
        int endLine = node.endLine() != null ? Math.max(node.endLine(), startLine) : startLine;
        return Symbol.builder()
                .id(node.id())
                .repoId(repoId)
                .name(node.name())
                .kind(node.kind())
                .filePath(node.filePath())
                .language(node.language())
                .span(new SourceSpan(startLine, 1, endLine, 1))
                .parentId(node.parentId())
                .attributes(node.attributes())
                .build();
    }

    private static Edge toEdge(String repoId, GraphDocument.Link link) {
        return Edge.builder()
                .id(link.id())
                .repoId(repoId)
                .sourceId(link.source())
                .targetId(link.target())
                .kind(link.kind())
                .attributes(link.attributes())
                .build();
    }
}
