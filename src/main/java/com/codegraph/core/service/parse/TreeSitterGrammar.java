package com.codegraph.core.service.parse;

import com.codegraph.core.service.model.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterTypescript;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps source languages to the bundled tree-sitter grammars.
 *
 * Creating a grammar loads its native library, so instances are only built on demand.
 */
public enum TreeSitterGrammar {

    PYTHON(Language.PYTHON, TreeSitterPython::new),
    TYPESCRIPT(Language.TYPESCRIPT, TreeSitterTypescript::new),
    JAVASCRIPT(Language.JAVASCRIPT, TreeSitterJavascript::new);

    private final Language language;
    private final Supplier<TSLanguage> factory;

    TreeSitterGrammar(Language language, Supplier<TSLanguage> factory) {
        this.language = language;
        this.factory = factory;
    }

    public Language getLanguage() {
        return language;
    }

    /**
     * Loads the grammar.
     *
     * @throws UnsatisfiedLinkError when the native library is missing for this platform
     */
    public TSLanguage load() {
        return factory.get();
    }

    public static Optional<TreeSitterGrammar> forLanguage(Language language) {
        return Arrays.stream(values())
                .filter(grammar -> grammar.language == language)
                .findFirst();
    }
}
