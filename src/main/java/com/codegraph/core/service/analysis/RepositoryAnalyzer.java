package com.codegraph.core.service.analysis;

import java.util.List;

/**
 * A read-only analysis over an indexed repository.
 */
public interface RepositoryAnalyzer {

    AnalysisCategory getCategory();

    /**
     * Short name used in logs.
     */
    String getName();

    List<Finding> analyze(AnalysisContext context);
}
