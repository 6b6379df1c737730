package com.codegraph.core.service.analysis;

import com.codegraph.core.service.ingest.ParseUnit;
import com.codegraph.core.service.store.GraphStore;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs of one analysis run. Analyzers only read from the graph store.
 */
public record AnalysisContext(
        String repoId,
        Path repositoryRoot,
        List<ParseUnit> parseUnits,
        GraphStore graphStore
) {
}
