package com.codegraph.core.service.store;

/**
 * Counts of items written by a bulk import.
 */
public record ImportSummary(String repoId, int symbolsImported, int edgesImported) {
}
