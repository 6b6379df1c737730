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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Extraction rules for the tree-sitter TypeScript and JavaScript grammars.
 *
 * Top-level functions are collected before classes and their methods.
 */
@Slf4j
@Component
public class TypeScriptSymbolExtractor extends AbstractLanguageExtractor {

    private static final Set<String> PARAMETER_TYPES = Set.of("required_parameter", "optional_parameter");

    @Override
    public Set<Language> getSupportedLanguages() {
        return EnumSet.of(Language.TYPESCRIPT, Language.JAVASCRIPT);
    }

    @Override
    public ExtractionResult extract(SyntaxNode root, ExtractionContext context) {
        List<Symbol> symbols = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        List<SyntaxNode> declarations = root.getChildren().stream()
                .flatMap(child -> unwrap(child, "export_statement", "declaration").stream())
                .toList();
        for (SyntaxNode declaration : declarations) {
            if ("function_declaration".equals(declaration.getType())) {
                attempt(context, declaration, () -> function(declaration, context, null)).ifPresent(symbols::add);
            }
        }
        for (SyntaxNode declaration : declarations) {
            if ("class_declaration".equals(declaration.getType())) {
                extractClass(declaration, context, symbols, edges);
            }
        }

        for (SyntaxNode statement : root.getChildrenOfType("import_statement")) {
            attempt(context, statement, () -> importEdges(statement, context, symbols)).ifPresent(edges::addAll);
        }

        for (SyntaxNode call : root.getDescendantsOfType("call_expression")) {
            attempt(context, call, () -> callEdgesFor(call, context, symbols)).ifPresent(edges::addAll);
        }

        return new ExtractionResult(symbols, edges);
    }

    // ==================== Declarations ====================

    private Symbol function(SyntaxNode node, ExtractionContext context, Symbol parent) {
        String name = requiredName(node);
        List<String> parameters = parameterNames(node);
        SymbolKind kind = parent != null ? SymbolKind.METHOD : SymbolKind.FUNCTION;
        return newSymbol(context, node, name, kind, null, signatureOf(name, parameters), parent,
                Map.of(Symbol.ATTR_PARAMETERS, parameters));
    }

    private List<String> parameterNames(SyntaxNode function) {
        List<String> names = new ArrayList<>();
        function.getChildByFieldName("parameters").ifPresent(parameters -> {
            for (SyntaxNode parameter : parameters.getChildren()) {
                if ("identifier".equals(parameter.getType())) {
                    names.add(parameter.getText());
                } else if ("assignment_pattern".equals(parameter.getType())) {
                    parameter.getChildByFieldName("left")
                            .filter(left -> "identifier".equals(left.getType()))
                            .map(SyntaxNode::getText)
                            .ifPresent(names::add);
                } else if (PARAMETER_TYPES.contains(parameter.getType())) {
                    parameter.getChildByFieldName("pattern")
                            .filter(pattern -> "identifier".equals(pattern.getType()))
                            .map(SyntaxNode::getText)
                            .ifPresent(names::add);
                }
            }
        });
        return names;
    }

    private void extractClass(SyntaxNode node, ExtractionContext context, List<Symbol> symbols, List<Edge> edges) {
        Optional<Symbol> extracted = attempt(context, node, () -> classSymbol(node, context));
        if (extracted.isEmpty()) {
            return;
        }
        Symbol classSymbol = extracted.get();
        symbols.add(classSymbol);

        node.getChildByFieldName("body").ifPresent(body -> {
            for (SyntaxNode member : body.getChildrenOfType("method_definition")) {
                attempt(context, member, () -> function(member, context, classSymbol)).ifPresent(method -> {
                    symbols.add(method);
                    edges.add(containsEdge(context, classSymbol, method));
                });
            }
        });
    }

    private Symbol classSymbol(SyntaxNode node, ExtractionContext context) {
        String name = requiredName(node);
        List<String> superclasses = new ArrayList<>();
        List<String> interfaces = new ArrayList<>();
        for (SyntaxNode heritage : node.getChildrenOfType("class_heritage")) {
            for (SyntaxNode clause : heritage.getChildren()) {
                // JavaScript puts the superclass expression directly under class_heritage
                if (isTypeReference(clause)) {
                    superclasses.add(clause.getText());
                    continue;
                }
                List<String> target = "implements_clause".equals(clause.getType()) ? interfaces : superclasses;
                for (SyntaxNode type : clause.getChildren()) {
                    if (isTypeReference(type)) {
                        target.add(type.getText());
                    }
                }
            }
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(Symbol.ATTR_SUPERCLASSES, superclasses);
        if (!interfaces.isEmpty()) {
            attributes.put("interfaces", interfaces);
        }
        return newSymbol(context, node, name, SymbolKind.CLASS, null, null, null, attributes);
    }

    private boolean isTypeReference(SyntaxNode node) {
        return switch (node.getType()) {
            case "identifier", "type_identifier", "member_expression", "nested_type_identifier" -> true;
            default -> false;
        };
    }

    // ==================== Imports ====================

    private List<Edge> importEdges(SyntaxNode statement, ExtractionContext context, List<Symbol> symbols) {
        String module = statement.getChildByFieldName("source")
                .map(source -> PythonSymbolExtractor.stripQuotes(source.getText()))
                .orElseThrow(() -> new ExtractionException("Import without source", statement));

        List<String> namedImports = new ArrayList<>();
        boolean wholeModule = true;
        for (SyntaxNode clause : statement.getChildrenOfType("import_clause")) {
            wholeModule = false;
            for (SyntaxNode part : clause.getChildren()) {
                if ("named_imports".equals(part.getType())) {
                    for (SyntaxNode specifier : part.getChildrenOfType("import_specifier")) {
                        specifier.getChildByFieldName("name").map(SyntaxNode::getText).ifPresent(namedImports::add);
                    }
                } else if ("identifier".equals(part.getType()) || "namespace_import".equals(part.getType())) {
                    wholeModule = true;
                }
            }
        }

        List<Edge> edges = new ArrayList<>();
        if (wholeModule) {
            edges.addAll(moduleImportEdges(context, symbols, module, statement));
        }
        if (!namedImports.isEmpty()) {
            edges.addAll(namedImportEdges(context, symbols, module, namedImports, statement));
        }
        return edges;
    }

    // ==================== Calls ====================

    private List<Edge> callEdgesFor(SyntaxNode call, ExtractionContext context, List<Symbol> symbols) {
        SyntaxNode function = call.getChildByFieldName("function")
                .orElseThrow(() -> new ExtractionException("Call without function", call));
        if ("identifier".equals(function.getType())) {
            return callEdges(context, symbols, function.getText(), false, call);
        }
        if ("member_expression".equals(function.getType())) {
            String property = function.getChildByFieldName("property")
                    .map(SyntaxNode::getText)
                    .orElseThrow(() -> new ExtractionException("Member call without property", call));
            return callEdges(context, symbols, property, true, call);
        }
        log.debug("Ignoring call through {} in {}", function.getType(), context.filePath());
        return List.of();
    }
}
