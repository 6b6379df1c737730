package com.codegraph.core.service.extract;

import com.codegraph.core.service.parse.SyntaxNode;

/**
 * Raised when a single syntax node cannot be converted; callers skip the node and continue.
 */
public class ExtractionException extends RuntimeException {

    private final transient SyntaxNode node;

    public ExtractionException(String message, SyntaxNode node) {
        super(message);
        this.node = node;
    }

    public SyntaxNode getNode() {
        return node;
    }
}
