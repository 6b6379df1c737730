package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;

import java.util.List;
import java.util.Map;

/**
 * Directed-graph interchange document for one repository.
 *
 * Written by {@link GraphStore#export(String)} and accepted back by bulk import.
 */
public record GraphDocument(
        String repoId,
        boolean directed,
        List<Node> nodes,
        List<Link> links
) {

    public GraphDocument {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static GraphDocument of(String repoId, List<Node> nodes, List<Link> links) {
        return new GraphDocument(repoId, true, nodes, links);
    }

    public record Node(
            String id,
            String name,
            SymbolKind kind,
            String filePath,
            Language language,
            Integer startLine,
            Integer endLine,
            String parentId,
            Map<String, Object> attributes
    ) {

        public static Node of(Symbol symbol) {
            return new Node(symbol.id(), symbol.name(), symbol.kind(), symbol.filePath(), symbol.language(),
                    symbol.span().startLine(), symbol.span().endLine(), symbol.parentId(), symbol.attributes());
        }
    }

    public record Link(
            String id,
            String source,
            String target,
            EdgeKind kind,
            Map<String, Object> attributes
    ) {

        public static Link of(Edge edge) {
            return new Link(edge.id(), edge.sourceId(), edge.targetId(), edge.kind(), edge.attributes());
        }
    }
}
