package com.codegraph.core.service.parse;

import com.codegraph.core.service.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up the {@link SourceParser} registered for a language.
 *
 * The first parser declaring a language wins.
 */
@Slf4j
@Component
public class SourceParserRegistry {

    private final Map<Language, SourceParser> parsers = new EnumMap<>(Language.class);

    public SourceParserRegistry(List<SourceParser> sourceParsers) {
        for (SourceParser parser : sourceParsers) {
            for (Language language : parser.getSupportedLanguages()) {
                parsers.putIfAbsent(language, parser);
            }
        }
        log.info("Source parsers registered for languages: {}", parsers.keySet());
    }

    public Optional<SourceParser> find(Language language) {
        return Optional.ofNullable(parsers.get(language));
    }

    public boolean supports(Language language) {
        return parsers.containsKey(language);
    }

    public Set<Language> getSupportedLanguages() {
        return parsers.keySet();
    }

    /**
     * Parses with the registered parser, or returns empty when no parser handles the language.
     */
    public Optional<SyntaxNode> parse(String content, Language language) {
        Optional<SourceParser> parser = find(language);
        if (parser.isEmpty()) {
            log.debug("No parser registered for language: {}", language);
            return Optional.empty();
        }
        return parser.get().parse(content, language);
    }
}
