package com.codegraph.core.service.store;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small symbol and edge builders shared by the graph store tests.
 */
final class GraphFixtures {

    static final String REPO = "repo-1";

    private GraphFixtures() {
    }

    static Symbol function(String name, String file, int line, String... parameters) {
        return symbol(name, SymbolKind.FUNCTION, file, line, List.of(parameters));
    }

    static Symbol symbol(String name, SymbolKind kind, String file, int line, List<String> parameters) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Symbol.ATTR_PARAMETERS, parameters);
        return Symbol.builder()
                .id(REPO + ":" + file + ":" + name)
                .repoId(REPO)
                .name(name)
                .kind(kind)
                .filePath(file)
                .language(Language.PYTHON)
                .span(new SourceSpan(line, 1, line + 1, 1))
                .attributes(attributes)
                .build();
    }

    static Edge calls(Symbol source, Symbol target, int line) {
        return edge(EdgeKind.CALLS, source, target, line);
    }

    static Edge edge(EdgeKind kind, Symbol source, Symbol target, int line) {
        return Edge.builder()
                .id(kind.getValue() + ":" + source.name() + "->" + target.name() + "@" + line)
                .repoId(REPO)
                .sourceId(source.id())
                .targetId(target.id())
                .kind(kind)
                .attributes(Map.of(Edge.ATTR_LINE, line, Edge.ATTR_COLUMN, 5))
                .build();
    }
}
