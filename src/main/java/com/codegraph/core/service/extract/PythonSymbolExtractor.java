package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import com.codegraph.core.service.parse.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extraction rules for the tree-sitter Python grammar.
 *
 * Symbols are collected first: top-level functions, then classes each followed by their
 * methods. Import and call edges are derived against that complete list, so the caller of
 * every call is the first top-level function when the file has one.
 */
@Slf4j
@Component
public class PythonSymbolExtractor extends AbstractLanguageExtractor {

    private static final Set<String> PARAMETER_WRAPPERS =
            Set.of("typed_parameter", "default_parameter", "typed_default_parameter");

    @Override
    public Set<Language> getSupportedLanguages() {
        return EnumSet.of(Language.PYTHON);
    }

    @Override
    public ExtractionResult extract(SyntaxNode root, ExtractionContext context) {
        List<Symbol> symbols = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        List<SyntaxNode> definitions = root.getChildren().stream()
                .flatMap(child -> unwrap(child, "decorated_definition", "definition").stream())
                .toList();
        for (SyntaxNode definition : definitions) {
            if ("function_definition".equals(definition.getType())) {
                attempt(context, definition, () -> function(definition, context, null)).ifPresent(symbols::add);
            }
        }
        for (SyntaxNode definition : definitions) {
            if ("class_definition".equals(definition.getType())) {
                extractClass(definition, context, symbols, edges);
            }
        }

        for (SyntaxNode child : root.getChildren()) {
            if ("import_statement".equals(child.getType())) {
                attempt(context, child, () -> importEdges(child, context, symbols)).ifPresent(edges::addAll);
            } else if ("import_from_statement".equals(child.getType())) {
                attempt(context, child, () -> fromImportEdges(child, context, symbols)).ifPresent(edges::addAll);
            }
        }

        for (SyntaxNode call : root.getDescendantsOfType("call")) {
            attempt(context, call, () -> callEdgesFor(call, context, symbols)).ifPresent(edges::addAll);
        }

        return new ExtractionResult(symbols, edges);
    }

    // ==================== Functions ====================

    private Symbol function(SyntaxNode node, ExtractionContext context, Symbol parent) {
        String name = requiredName(node);
        List<String> parameters = parameterNames(node);
        SymbolKind kind = parent != null ? SymbolKind.METHOD : SymbolKind.FUNCTION;
        return newSymbol(context, node, name, kind,
                docstringOf(node).orElse(null),
                signatureOf(name, parameters),
                parent,
                Map.of(Symbol.ATTR_PARAMETERS, parameters));
    }

    private List<String> parameterNames(SyntaxNode function) {
        List<String> names = new ArrayList<>();
        function.getChildByFieldName("parameters").ifPresent(parameters -> {
            for (SyntaxNode parameter : parameters.getChildren()) {
                parameterName(parameter).ifPresent(names::add);
            }
        });
        return names;
    }

    private Optional<String> parameterName(SyntaxNode parameter) {
        if ("identifier".equals(parameter.getType())) {
            return Optional.of(parameter.getText());
        }
        if (PARAMETER_WRAPPERS.contains(parameter.getType())) {
            return parameter.getChildByFieldName("name")
                    .or(() -> parameter.getChildrenOfType("identifier").stream().findFirst())
                    .map(SyntaxNode::getText);
        }
        return Optional.empty();
    }

    /**
     * Docstring of a function or class: only when the first body statement is a bare string.
     */
    private Optional<String> docstringOf(SyntaxNode definition) {
        return definition.getChildByFieldName("body")
                .flatMap(SyntaxNode::getFirstChild)
                .filter(statement -> "expression_statement".equals(statement.getType()))
                .flatMap(SyntaxNode::getFirstChild)
                .filter(expression -> "string".equals(expression.getType()))
                .map(string -> stripQuotes(string.getText()));
    }

    static String stripQuotes(String literal) {
        String text = literal.strip();
        int prefix = 0;
        while (prefix < text.length() && prefix < 2 && "rRbBuUfF".indexOf(text.charAt(prefix)) >= 0) {
            prefix++;
        }
        text = text.substring(prefix);
        if ((text.startsWith("\"\"\"") || text.startsWith("'''")) && text.length() >= 6) {
            text = text.substring(3, text.length() - 3);
        } else if ((text.startsWith("\"") || text.startsWith("'")) && text.length() >= 2) {
            text = text.substring(1, text.length() - 1);
        }
        return text.strip();
    }

    // ==================== Classes ====================

    private void extractClass(SyntaxNode node, ExtractionContext context, List<Symbol> symbols, List<Edge> edges) {
        Optional<Symbol> extracted = attempt(context, node, () -> classSymbol(node, context));
        if (extracted.isEmpty()) {
            return;
        }
        Symbol classSymbol = extracted.get();
        symbols.add(classSymbol);

        for (SyntaxNode member : classMembers(node)) {
            unwrap(member, "decorated_definition", "definition")
                    .filter(definition -> "function_definition".equals(definition.getType()))
                    .flatMap(definition -> attempt(context, definition, () -> function(definition, context, classSymbol)))
                    .ifPresent(method -> {
                        symbols.add(method);
                        edges.add(containsEdge(context, classSymbol, method));
                    });
        }
    }

    private Symbol classSymbol(SyntaxNode node, ExtractionContext context) {
        String name = requiredName(node);
        List<String> superclasses = new ArrayList<>();
        node.getChildByFieldName("superclasses")
                .or(() -> node.getChildByFieldName("arguments"))
                .ifPresent(arguments -> {
                    for (SyntaxNode argument : arguments.getChildren()) {
                        if ("identifier".equals(argument.getType()) || "attribute".equals(argument.getType())) {
                            superclasses.add(argument.getText());
                        }
                    }
                });
        return newSymbol(context, node, name, SymbolKind.CLASS,
                docstringOf(node).orElse(null),
                null,
                null,
                Map.of(Symbol.ATTR_SUPERCLASSES, superclasses));
    }

    private List<SyntaxNode> classMembers(SyntaxNode classNode) {
        return classNode.getChildByFieldName("body")
                .map(SyntaxNode::getChildren)
                .orElseGet(classNode::getChildren);
    }

    // ==================== Imports ====================

    private List<Edge> importEdges(SyntaxNode statement, ExtractionContext context, List<Symbol> symbols) {
        List<Edge> edges = new ArrayList<>();
        for (String module : importedNames(statement)) {
            edges.addAll(moduleImportEdges(context, symbols, module, statement));
        }
        return edges;
    }

    private List<Edge> fromImportEdges(SyntaxNode statement, ExtractionContext context, List<Symbol> symbols) {
        String module = statement.getChildByFieldName("module_name")
                .map(SyntaxNode::getText)
                .orElseThrow(() -> new ExtractionException("Missing module_name", statement));
        return namedImportEdges(context, symbols, module, importedNames(statement), statement);
    }

    private List<String> importedNames(SyntaxNode statement) {
        List<SyntaxNode> nameNodes = statement.getChildrenByFieldName("name");
        // a wildcard from-import has no names
        if (nameNodes.isEmpty() && "import_statement".equals(statement.getType())) {
            nameNodes = statement.getChildrenOfType("dotted_name");
        }
        List<String> names = new ArrayList<>();
        for (SyntaxNode nameNode : nameNodes) {
            if ("aliased_import".equals(nameNode.getType())) {
                nameNode.getChildByFieldName("name").map(SyntaxNode::getText).ifPresent(names::add);
            } else {
                names.add(nameNode.getText());
            }
        }
        return names;
    }

    // ==================== Calls ====================

    private List<Edge> callEdgesFor(SyntaxNode call, ExtractionContext context, List<Symbol> symbols) {
        SyntaxNode function = call.getChildByFieldName("function")
                .orElseThrow(() -> new ExtractionException("Call without function", call));
        if ("identifier".equals(function.getType())) {
            return callEdges(context, symbols, function.getText(), false, call);
        }
        if ("attribute".equals(function.getType())) {
            String attribute = function.getChildByFieldName("attribute")
                    .map(SyntaxNode::getText)
                    .orElseThrow(() -> new ExtractionException("Attribute call without name", call));
            return callEdges(context, symbols, attribute, true, call);
        }
        log.debug("Ignoring call through {} in {}", function.getType(), context.filePath());
        return List.of();
    }
}
