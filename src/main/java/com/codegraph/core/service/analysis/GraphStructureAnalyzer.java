package com.codegraph.core.service.analysis;

import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.store.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static analysis over the stored graph: unreferenced symbols, dependency cycles and
 * functions that take input without calling anything that validates it.
 */
@Slf4j
@Component
public class GraphStructureAnalyzer implements RepositoryAnalyzer {

    static final String RULE_ORPHAN = "orphan-symbol";
    static final String RULE_CYCLE = "dependency-cycle";
    static final String RULE_VALIDATION_GAP = "missing-input-validation";

    @Override
    public AnalysisCategory getCategory() {
        return AnalysisCategory.STATIC;
    }

    @Override
    public String getName() {
        return "graph-structure";
    }

    @Override
    public List<Finding> analyze(AnalysisContext context) {
        GraphStore store = context.graphStore();
        String repoId = context.repoId();

        List<Finding> findings = new ArrayList<>();
        store.orphanSymbols(repoId).forEach(symbol -> findings.add(orphanFinding(repoId, symbol)));
        store.cycles(repoId).forEach(cycle -> findings.add(cycleFinding(repoId, cycle)));
        store.endpointsWithoutValidation(repoId).forEach(symbol -> findings.add(validationFinding(repoId, symbol)));

        log.debug("Graph structure analysis of {} produced {} findings", repoId, findings.size());
        return findings;
    }

    // ==================== Finding Builders ====================

    private Finding orphanFinding(String repoId, Symbol symbol) {
        return anchoredTo(symbol, Finding.builder()
                .id(Finding.idFor(repoId, RULE_ORPHAN, symbol.id()))
                .repoId(repoId)
                .type(FindingType.MAINTAINABILITY)
                .severity(Severity.LOW)
                .title("Unreferenced " + symbol.kind().getValue() + " '" + symbol.name() + "'")
                .description("No other symbol in the repository calls, imports or contains '"
                        + symbol.name() + "'. It may be dead code or an undocumented entry point.")
                .ruleId(RULE_ORPHAN))
                .build();
    }

    private Finding cycleFinding(String repoId, List<String> cycle) {
        String path = String.join(" -> ", cycle);
        return Finding.builder()
                .id(Finding.idFor(repoId, RULE_CYCLE, path))
                .repoId(repoId)
                .type(FindingType.ARCHITECTURE)
                .severity(Severity.MEDIUM)
                .title("Dependency cycle through '" + cycle.get(0) + "'")
                .description("Symbols depend on each other in a cycle: " + path)
                .ruleId(RULE_CYCLE)
                .metadata(Map.of("cycle", cycle))
                .build();
    }

    private Finding validationFinding(String repoId, Symbol symbol) {
        return anchoredTo(symbol, Finding.builder()
                .id(Finding.idFor(repoId, RULE_VALIDATION_GAP, symbol.id()))
                .repoId(repoId)
                .type(FindingType.SECURITY)
                .severity(Severity.MEDIUM)
                .title("Unvalidated parameters in '" + symbol.name() + "'")
                .description("'" + symbol.name() + "' accepts " + symbol.parameterNames()
                        + " but never calls a validate or check routine.")
                .ruleId(RULE_VALIDATION_GAP)
                .metadata(Map.of("parameters", symbol.parameterNames())))
                .build();
    }

    private Finding.FindingBuilder anchoredTo(Symbol symbol, Finding.FindingBuilder builder) {
        return builder
                .filePath(symbol.filePath())
                .startLine(symbol.span().startLine())
                .endLine(symbol.span().endLine())
                .symbolId(symbol.id());
    }
}
