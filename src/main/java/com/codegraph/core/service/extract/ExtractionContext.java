package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Language;

/**
 * File-level context passed to a language extractor.
 */
public record ExtractionContext(String repoId, String filePath, Language language) {
}
