package com.codegraph.core.service.extract;

import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.parse.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches extraction to the {@link LanguageExtractor} registered for the file's language.
 */
@Slf4j
@Component
public class DefaultSymbolExtractor implements SymbolExtractor {

    private final Map<Language, LanguageExtractor> extractors = new EnumMap<>(Language.class);

    public DefaultSymbolExtractor(List<LanguageExtractor> languageExtractors) {
        for (LanguageExtractor extractor : languageExtractors) {
            extractor.getSupportedLanguages().forEach(language -> extractors.putIfAbsent(language, extractor));
        }
        log.info("Symbol extractors registered for languages: {}", extractors.keySet());
    }

    @Override
    public ExtractionResult extract(SyntaxNode root, String filePath, Language language, String repoId) {
        LanguageExtractor extractor = extractors.get(language);
        if (extractor == null || root == null) {
            log.debug("No extraction for {} ({})", filePath, language);
            return ExtractionResult.empty();
        }

        var result = extractor.extract(root, new ExtractionContext(repoId, filePath, language));
        log.debug("Extracted {} symbols and {} edges from {}",
                result.symbols().size(), result.edges().size(), filePath);
        return result;
    }

    @Override
    public boolean supports(Language language) {
        return extractors.containsKey(language);
    }
}
