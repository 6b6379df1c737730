package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.parse.SyntaxNode;

import java.util.Set;

/**
 * Extraction rules for one grammar family.
 */
public interface LanguageExtractor {

    Set<Language> getSupportedLanguages();

    ExtractionResult extract(SyntaxNode root, ExtractionContext context);
}
