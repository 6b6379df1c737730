package com.codegraph.core.service.parse;

import com.codegraph.core.service.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSInputEncoding;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSReader;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses source with the bundled tree-sitter grammars.
 *
 * Grammars are loaded once; a grammar whose native library cannot be loaded on this platform is
 * left out and its language reported as unsupported. A {@link TSParser} is not thread-safe, so
 * every call gets its own.
 */
@Slf4j
@Component
public class TreeSitterSourceParser implements SourceParser {

    private static final int READ_BUFFER_SIZE = 8 * 1024;

    private final Map<Language, TSLanguage> grammars = new EnumMap<>(Language.class);

    public TreeSitterSourceParser() {
        for (TreeSitterGrammar grammar : TreeSitterGrammar.values()) {
            try {
                grammars.put(grammar.getLanguage(), grammar.load());
            } catch (RuntimeException | LinkageError e) {
                log.warn("Tree-sitter grammar for {} unavailable: {}", grammar.getLanguage(), e.getMessage());
            }
        }
        log.info("Tree-sitter grammars loaded for: {}", grammars.keySet());
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Collections.unmodifiableSet(grammars.keySet());
    }

    @Override
    public Optional<SyntaxNode> parse(String content, Language language) {
        TSLanguage grammar = grammars.get(language);
        if (grammar == null) {
            return Optional.empty();
        }

        byte[] source = content.getBytes(StandardCharsets.UTF_8);
        TSParser parser = new TSParser();
        if (!parser.setLanguage(grammar)) {
            log.warn("Tree-sitter rejected the {} grammar", language);
            return Optional.empty();
        }

        TSTree tree = parser.parse(new byte[READ_BUFFER_SIZE], null, reader(source),
                TSInputEncoding.TSInputEncodingUTF8);
        if (tree == null) {
            log.warn("Tree-sitter returned no tree for {} source", language);
            return Optional.empty();
        }

        TreeSitterSyntaxNode root = new TreeSitterSyntaxNode(tree.getRootNode(), source);
        if (root.hasError()) {
            log.debug("{} source has syntax errors; extracting the parts that parsed", language);
        }
        return Optional.of(root);
    }

    private static TSReader reader(byte[] source) {
        return (buffer, offset, position) -> {
            if (offset >= source.length) {
                return 0;
            }
            int length = Math.min(buffer.length, source.length - offset);
            System.arraycopy(source, offset, buffer, 0, length);
            return length;
        };
    }
}
