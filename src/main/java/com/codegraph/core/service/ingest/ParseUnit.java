package com.codegraph.core.service.ingest;

import com.codegraph.core.service.extract.ExtractionResult;
import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.parse.SyntaxNode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One source file of a job.
 *
 * Extraction output is recorded exactly once; afterwards the unit is read-only.
 */
@Getter
public class ParseUnit {

    private final String id;
    private final String repoId;
    private final String filePath;
    private final Language language;
    private final String content;
    private final long sizeBytes;

    private SyntaxNode syntaxTree;
    private List<Symbol> symbols = List.of();
    private List<Edge> edges = List.of();
    private boolean extracted;

    public ParseUnit(String repoId, String filePath, Language language, String content, Long sizeBytes) {
        this.id = UUID.randomUUID().toString();
        this.repoId = repoId;
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.language = Objects.requireNonNull(language, "language");
        this.content = Objects.requireNonNull(content, "content");
        this.sizeBytes = sizeBytes != null ? sizeBytes : content.getBytes(StandardCharsets.UTF_8).length;
    }

    public static ParseUnit of(String repoId, String filePath, Language language, String content) {
        return new ParseUnit(repoId, filePath, language, content, null);
    }

    /**
     * Stores the syntax tree and extraction output of this file.
     *
     * @throws IllegalStateException if output was already recorded
     */
    public synchronized void recordExtraction(SyntaxNode tree, ExtractionResult result) {
        if (extracted) {
            throw new IllegalStateException("Extraction already recorded for " + filePath);
        }
        this.syntaxTree = tree;
        this.symbols = List.copyOf(result.symbols());
        this.edges = List.copyOf(result.edges());
        this.extracted = true;
    }

    public synchronized boolean isExtracted() {
        return extracted;
    }

    public synchronized List<Symbol> getSymbols() {
        return symbols;
    }

    public synchronized List<Edge> getEdges() {
        return edges;
    }

    public synchronized SyntaxNode getSyntaxTree() {
        return syntaxTree;
    }
}
