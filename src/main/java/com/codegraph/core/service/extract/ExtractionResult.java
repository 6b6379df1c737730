package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.Symbol;

import java.util.List;

/**
 * Symbols and edges extracted from one file, in first-discovered order.
 */
public record ExtractionResult(List<Symbol> symbols, List<Edge> edges) {

    public ExtractionResult {
        symbols = List.copyOf(symbols);
        edges = List.copyOf(edges);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return symbols.isEmpty() && edges.isEmpty();
    }
}
