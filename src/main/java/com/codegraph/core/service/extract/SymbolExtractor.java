package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.parse.SyntaxNode;

/**
 * Derives symbols and edges from the syntax tree of one file.
 *
 * Implementations are pure with respect to their inputs and keep no state between files.
 */
public interface SymbolExtractor {

    /**
     * Extracts symbols and edges.
     *
     * @param root the root of the parsed file
     * @param filePath repository-relative path of the file
     * @param language language of the file
     * @param repoId owning repository id
     * @return the extraction output; empty for unsupported languages
     */
    ExtractionResult extract(SyntaxNode root, String filePath, Language language, String repoId);

    boolean supports(Language language);
}
