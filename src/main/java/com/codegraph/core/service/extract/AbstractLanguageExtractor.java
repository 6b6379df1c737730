package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import com.codegraph.core.service.parse.SyntaxNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared building blocks for language extractors: symbol and edge construction,
 * the import and call heuristics, and best-effort node handling.
 */
@Slf4j
public abstract class AbstractLanguageExtractor implements LanguageExtractor {

    // ==================== Symbols ====================

    protected Symbol newSymbol(ExtractionContext context, SyntaxNode node, String name, SymbolKind kind,
                               String docstring, String signature, Symbol parent,
                               Map<String, Object> attributes) {
        SourceSpan span = spanOf(node);
        if (parent != null && !parent.span().contains(span)) {
            throw new ExtractionException("Span of " + name + " escapes its parent " + parent.name(), node);
        }
        return Symbol.builder()
                .id(SymbolIds.symbolId(context.repoId(), context.filePath(), kind, name, span))
                .repoId(context.repoId())
                .name(name)
                .kind(kind)
                .filePath(context.filePath())
                .language(context.language())
                .span(span)
                .docstring(docstring)
                .signature(signature)
                .parentId(parent != null ? parent.id() : null)
                .attributes(attributes)
                .build();
    }

    protected static SourceSpan spanOf(SyntaxNode node) {
        return SourceSpan.fromZeroBased(
                node.getStartPoint().row(), node.getStartPoint().column(),
                node.getEndPoint().row(), node.getEndPoint().column());
    }

    protected static String requiredName(SyntaxNode node) {
        return node.getChildByFieldName("name")
                .map(SyntaxNode::getText)
                .filter(text -> !text.isBlank())
                .orElseThrow(() -> new ExtractionException("Missing name on " + node.getType(), node));
    }

    protected static String signatureOf(String name, List<String> parameters) {
        return name + "(" + String.join(", ", parameters) + ")";
    }

    // ==================== Edges ====================

    protected Edge containsEdge(ExtractionContext context, Symbol parent, Symbol child) {
        return Edge.builder()
                .id(SymbolIds.edgeId(context.repoId(), EdgeKind.CONTAINS, parent.id(), child.id(),
                        child.span().startLine(), child.span().startColumn()))
                .repoId(context.repoId())
                .sourceId(parent.id())
                .targetId(child.id())
                .kind(EdgeKind.CONTAINS)
                .build();
    }

    /**
     * Plain import: every function and class symbol of the file imports the module.
     *
     * Over-approximates: the statement is not attributed to its enclosing symbol.
     */
    protected List<Edge> moduleImportEdges(ExtractionContext context, List<Symbol> symbols,
                                           String module, SyntaxNode statement) {
        List<Edge> edges = new ArrayList<>();
        for (Symbol symbol : symbols) {
            if (symbol.kind() == SymbolKind.FUNCTION || symbol.kind() == SymbolKind.CLASS) {
                edges.add(importEdge(context, symbol, Map.of(Edge.ATTR_MODULE, module), module, statement));
            }
        }
        return edges;
    }

    /**
     * Named import: only symbols whose name equals an imported identifier get an edge.
     */
    protected List<Edge> namedImportEdges(ExtractionContext context, List<Symbol> symbols,
                                          String module, List<String> names, SyntaxNode statement) {
        List<Edge> edges = new ArrayList<>();
        for (String name : names) {
            for (Symbol symbol : symbols) {
                if (symbol.name().equals(name)) {
                    Map<String, Object> attributes = new LinkedHashMap<>();
                    attributes.put(Edge.ATTR_MODULE, module);
                    attributes.put(Edge.ATTR_NAME, name);
                    edges.add(importEdge(context, symbol, attributes, module + ":" + name, statement));
                }
            }
        }
        return edges;
    }

    private Edge importEdge(ExtractionContext context, Symbol source, Map<String, Object> attributes,
                            String targetRef, SyntaxNode statement) {
        SourceSpan site = spanOf(statement);
        return Edge.builder()
                .id(SymbolIds.edgeId(context.repoId(), EdgeKind.IMPORTS, source.id(), "module:" + targetRef,
                        site.startLine(), site.startColumn()))
                .repoId(context.repoId())
                .sourceId(source.id())
                .kind(EdgeKind.IMPORTS)
                .attributes(attributes)
                .build();
    }

    /**
     * Call heuristic: the caller is the first function or method symbol of the file; the callee
     * is every in-file symbol with the called name (methods only for attribute access).
     *
     * When nothing in the file matches, a single unresolved edge records the callee name so
     * the pipeline can resolve it against other files of the repository.
     */
    protected List<Edge> callEdges(ExtractionContext context, List<Symbol> symbols,
                                   String calleeName, boolean methodOnly, SyntaxNode call) {
        Optional<Symbol> caller = symbols.stream()
                .filter(symbol -> symbol.kind().isCallable())
                .findFirst();
        if (caller.isEmpty()) {
            log.debug("No caller candidate for call to {} in {}", calleeName, context.filePath());
            return List.of();
        }

        SourceSpan site = spanOf(call);
        List<Edge> edges = new ArrayList<>();
        for (Symbol symbol : symbols) {
            if (symbol.name().equals(calleeName) && matchesCallee(symbol, methodOnly)) {
                edges.add(callEdge(context, caller.get(), symbol.id(), Map.of(), site));
            }
        }
        if (edges.isEmpty()) {
            Map<String, Object> attributes = Map.of(
                    Edge.ATTR_CALLEE, calleeName,
                    Edge.ATTR_CALLEE_KIND, methodOnly ? SymbolKind.METHOD.getValue() : "callable");
            edges.add(callEdge(context, caller.get(), null, attributes, site));
        }
        return edges;
    }

    private boolean matchesCallee(Symbol symbol, boolean methodOnly) {
        return methodOnly ? symbol.kind() == SymbolKind.METHOD : symbol.kind().isCallable();
    }

    private Edge callEdge(ExtractionContext context, Symbol caller, String targetId,
                          Map<String, Object> extraAttributes, SourceSpan site) {
        Map<String, Object> attributes = new LinkedHashMap<>(extraAttributes);
        attributes.put(Edge.ATTR_LINE, site.startLine());
        attributes.put(Edge.ATTR_COLUMN, site.startColumn());
        String targetRef = targetId != null ? targetId : "callee:" + extraAttributes.get(Edge.ATTR_CALLEE);
        return Edge.builder()
                .id(SymbolIds.edgeId(context.repoId(), EdgeKind.CALLS, caller.id(), targetRef,
                        site.startLine(), site.startColumn()))
                .repoId(context.repoId())
                .sourceId(caller.id())
                .targetId(targetId)
                .kind(EdgeKind.CALLS)
                .attributes(attributes)
                .build();
    }

    // ==================== Best-effort Handling ====================

    /**
     * Runs one node conversion; failures are logged and the node is skipped.
     */
    protected <T> Optional<T> attempt(ExtractionContext context, SyntaxNode node, Supplier<T> conversion) {
        try {
            return Optional.ofNullable(conversion.get());
        } catch (RuntimeException e) {
            log.warn("Skipping {} at {}:{}: {}", node.getType(), context.filePath(),
                    node.getStartPoint().row() + 1, e.getMessage());
            return Optional.empty();
        }
    }

    protected static Optional<SyntaxNode> unwrap(SyntaxNode node, String wrapperType, String fieldName) {
        if (wrapperType.equals(node.getType())) {
            return node.getChildByFieldName(fieldName);
        }
        return Optional.of(node);
    }
}
