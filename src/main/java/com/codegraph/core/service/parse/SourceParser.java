package com.codegraph.core.service.parse;

import com.codegraph.core.service.model.Language;

import java.util.Optional;
import java.util.Set;

/**
 * Turns source text into a syntax tree.
 *
 * Implementations wrap a concrete parser; the rest of the service only sees {@link SyntaxNode}.
 */
public interface SourceParser {

    /**
     * Languages this parser accepts.
     */
    Set<Language> getSupportedLanguages();

    /**
     * Parses the given source.
     *
     * @param content the full file content
     * @param language the language of the content
     * @return the root node, or empty if the content could not be parsed
     */
    Optional<SyntaxNode> parse(String content, Language language);
}
