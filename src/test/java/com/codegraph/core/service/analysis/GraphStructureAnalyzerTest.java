package com.codegraph.core.service.analysis;

import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.SourceSpan;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.model.SymbolKind;
import com.codegraph.core.service.store.GraphImportData;
import com.codegraph.core.service.store.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class GraphStructureAnalyzerTest {

    private static final String REPO = "analysis-repo";

    private final GraphStructureAnalyzer analyzer = new GraphStructureAnalyzer();
    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore(100, 10);
        store.connect();

        Symbol entry = function("entry", 1, List.of());
        Symbol ping = function("ping", 10, List.of("host"));
        Symbol pong = function("pong", 20, List.of());
        store.importBulk(new GraphImportData(REPO, List.of(entry, ping, pong),
                List.of(call(entry, ping), call(ping, pong), call(pong, ping))));
    }

    @Test
    void reportsOrphansCyclesAndValidationGaps() {
        List<Finding> findings = analyzer.analyze(new AnalysisContext(REPO, Path.of("."), List.of(), store));

        assertThat(findings)
                .extracting(Finding::ruleId, Finding::type, Finding::severity)
                .containsExactly(
                        tuple(GraphStructureAnalyzer.RULE_ORPHAN, FindingType.MAINTAINABILITY, Severity.LOW),
                        tuple(GraphStructureAnalyzer.RULE_CYCLE, FindingType.ARCHITECTURE, Severity.MEDIUM),
                        tuple(GraphStructureAnalyzer.RULE_CYCLE, FindingType.ARCHITECTURE, Severity.MEDIUM),
                        tuple(GraphStructureAnalyzer.RULE_VALIDATION_GAP, FindingType.SECURITY, Severity.MEDIUM));

        Finding orphan = findings.get(0);
        assertThat(orphan.filePath()).isEqualTo("net.py");
        assertThat(orphan.startLine()).isEqualTo(1);
        assertThat(orphan.symbolId()).isEqualTo(REPO + ":entry");
        assertThat(findings.get(1).metadata()).containsEntry("cycle", List.of("ping", "pong", "ping"));
    }

    @Test
    void findingIdsAreStableAcrossRuns() {
        var context = new AnalysisContext(REPO, Path.of("."), List.of(), store);

        assertThat(analyzer.analyze(context)).extracting(Finding::id)
                .containsExactlyElementsOf(analyzer.analyze(context).stream().map(Finding::id).toList());
        assertThat(analyzer.getCategory()).isEqualTo(AnalysisCategory.STATIC);
    }

    private static Symbol function(String name, int line, List<String> parameters) {
        return Symbol.builder()
                .id(REPO + ":" + name)
                .repoId(REPO)
                .name(name)
                .kind(SymbolKind.FUNCTION)
                .filePath("net.py")
                .language(Language.PYTHON)
                .span(new SourceSpan(line, 1, line + 3, 1))
                .attributes(Map.of(Symbol.ATTR_PARAMETERS, parameters))
                .build();
    }

    private static Edge call(Symbol source, Symbol target) {
        return Edge.builder()
                .id(source.name() + "->" + target.name())
                .repoId(REPO)
                .sourceId(source.id())
                .targetId(target.id())
                .kind(EdgeKind.CALLS)
                .build();
    }
}
